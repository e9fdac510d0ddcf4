package fr.lapetina.tgbot.dispatch.context;

import fr.lapetina.tgbot.domain.model.SendMessage;

/**
 * Adjusts an outgoing reply before it is sent.
 */
@FunctionalInterface
public interface MessageOption {

    SendMessage apply(SendMessage message);

    /**
     * Shows link previews, which replies disable by default.
     */
    static MessageOption enableWebPagePreview() {
        return message -> message.withWebPagePreview(true);
    }

    /**
     * Sends the reply to another chat than the originating one.
     */
    static MessageOption chatId(long chatId) {
        return message -> message.withChatId(chatId);
    }

    /**
     * Quotes the message being handled.
     */
    static MessageOption replyTo(long messageId) {
        return message -> message.withReplyTo(messageId);
    }
}
