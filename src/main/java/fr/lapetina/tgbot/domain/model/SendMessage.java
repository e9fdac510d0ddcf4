package fr.lapetina.tgbot.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Outgoing text message for the {@code sendMessage} Bot API method.
 * Immutable and thread-safe.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SendMessage(
        @JsonProperty("chat_id") long chatId,
        @JsonProperty("text") String text,
        @JsonProperty("parse_mode") String parseMode,
        @JsonProperty("disable_web_page_preview") boolean disableWebPagePreview,
        @JsonProperty("reply_to_message_id") Long replyToMessageId
) {
    public static final String MODE_MARKDOWN = "Markdown";
    public static final String MODE_HTML = "HTML";

    public SendMessage {
        Objects.requireNonNull(text, "Text is required");
    }

    /**
     * Creates a plain text message with web page preview disabled.
     */
    public static SendMessage of(long chatId, String text) {
        return new SendMessage(chatId, text, null, true, null);
    }

    public SendMessage withChatId(long chatId) {
        return new SendMessage(chatId, text, parseMode, disableWebPagePreview, replyToMessageId);
    }

    public SendMessage withParseMode(String parseMode) {
        return new SendMessage(chatId, text, parseMode, disableWebPagePreview, replyToMessageId);
    }

    public SendMessage withWebPagePreview(boolean enabled) {
        return new SendMessage(chatId, text, parseMode, !enabled, replyToMessageId);
    }

    public SendMessage withReplyTo(Long messageId) {
        return new SendMessage(chatId, text, parseMode, disableWebPagePreview, messageId);
    }
}
