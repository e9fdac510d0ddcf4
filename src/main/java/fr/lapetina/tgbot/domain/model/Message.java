package fr.lapetina.tgbot.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Telegram message. Immutable.
 *
 * Command parsing follows the Bot API rules: a message is a command when its first
 * entity is a {@code bot_command} starting at offset 0. For {@code "/start@my_bot hello"}
 * the command is {@code start} and the arguments are {@code hello}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(
        @JsonProperty("message_id") long messageId,
        @JsonProperty("from") User from,
        @JsonProperty("chat") Chat chat,
        @JsonProperty("date") long date,
        @JsonProperty("text") String text,
        @JsonProperty("entities") List<MessageEntity> entities
) {
    public Message {
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    /**
     * Creates a plain text message, detecting a leading command the way Telegram does.
     */
    public static Message ofText(long messageId, Chat chat, User from, String text) {
        List<MessageEntity> entities = List.of();
        if (text != null && text.startsWith("/") && text.length() > 1) {
            int end = text.indexOf(' ');
            int length = end < 0 ? text.length() : end;
            entities = List.of(new MessageEntity(MessageEntity.BOT_COMMAND, 0, length));
        }
        return new Message(messageId, from, chat, Instant.now().getEpochSecond(), text, entities);
    }

    @JsonIgnore
    public boolean isCommand() {
        if (entities.isEmpty() || text == null) {
            return false;
        }
        MessageEntity entity = entities.get(0);
        return entity.offset() == 0 && entity.isCommand();
    }

    /**
     * Returns the command name without the leading slash and without any
     * {@code @botname} suffix, or an empty string if this is not a command.
     */
    @JsonIgnore
    public String command() {
        String command = commandWithAt();
        int at = command.indexOf('@');
        return at < 0 ? command : command.substring(0, at);
    }

    /**
     * Returns the command including any {@code @botname} suffix.
     */
    @JsonIgnore
    public String commandWithAt() {
        if (!isCommand()) {
            return "";
        }
        int length = Math.min(entities.get(0).length(), text.length());
        return length <= 1 ? "" : text.substring(1, length);
    }

    /**
     * Returns everything after the command and the following separator.
     */
    @JsonIgnore
    public String commandArguments() {
        if (!isCommand()) {
            return "";
        }
        int length = entities.get(0).length();
        if (text.length() <= length + 1) {
            return "";
        }
        return text.substring(length + 1);
    }

    @JsonIgnore
    public Instant sentAt() {
        return Instant.ofEpochSecond(date);
    }
}
