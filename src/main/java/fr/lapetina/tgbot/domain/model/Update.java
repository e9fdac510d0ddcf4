package fr.lapetina.tgbot.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One incoming update from the Bot API.
 * Immutable; at most one of the optional payloads is present.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Update(
        @JsonProperty("update_id") long updateId,
        @JsonProperty("message") Message message,
        @JsonProperty("edited_message") Message editedMessage,
        @JsonProperty("channel_post") Message channelPost,
        @JsonProperty("edited_channel_post") Message editedChannelPost,
        @JsonProperty("callback_query") CallbackQuery callbackQuery
) {

    public static Update ofMessage(long updateId, Message message) {
        return new Update(updateId, message, null, null, null, null);
    }

    public static Update ofCallbackQuery(long updateId, CallbackQuery callbackQuery) {
        return new Update(updateId, null, null, null, null, callbackQuery);
    }

    /**
     * Only a new {@code message} can carry a command to dispatch.
     */
    @JsonIgnore
    public boolean isCommand() {
        return message != null && message.isCommand();
    }

    /**
     * Returns the first present message payload, in the order message, edited message,
     * channel post, edited channel post. Null when none is present.
     */
    @JsonIgnore
    public Message effectiveMessage() {
        if (message != null) {
            return message;
        }
        if (editedMessage != null) {
            return editedMessage;
        }
        if (channelPost != null) {
            return channelPost;
        }
        return editedChannelPost;
    }

    /**
     * Returns the sender of this update, or null for anonymous channel posts.
     */
    @JsonIgnore
    public User sentFrom() {
        if (callbackQuery != null) {
            return callbackQuery.from();
        }
        Message effective = effectiveMessage();
        return effective != null ? effective.from() : null;
    }

    /**
     * Returns the chat this update originates from, or null when there is none.
     */
    @JsonIgnore
    public Chat fromChat() {
        Message effective = effectiveMessage();
        if (effective != null) {
            return effective.chat();
        }
        if (callbackQuery != null && callbackQuery.message() != null) {
            return callbackQuery.message().chat();
        }
        return null;
    }
}
