package fr.lapetina.tgbot.dispatch.context;

import fr.lapetina.tgbot.dispatch.CancellationToken;
import fr.lapetina.tgbot.domain.model.Chat;
import fr.lapetina.tgbot.domain.model.Message;
import fr.lapetina.tgbot.domain.model.SendMessage;
import fr.lapetina.tgbot.domain.model.Update;
import fr.lapetina.tgbot.domain.model.User;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApi;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApiException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Execution context handed to command and update handlers.
 *
 * This is a mutable holder reused through {@link BotContextPool}. It is bound to exactly
 * one update at a time and owned by the worker handling that update; handlers must not
 * keep a reference to it after they return.
 */
public final class BotContext {

    private final TelegramApi api;
    private final AtomicBoolean bound = new AtomicBoolean(false);

    private Update update;
    private CancellationToken token;

    BotContext(TelegramApi api) {
        this.api = Objects.requireNonNull(api, "TelegramApi is required");
    }

    /**
     * Binds the context to an update and its cancellation scope.
     *
     * @throws IllegalStateException if the context is still bound to another update
     */
    void bind(Update update, CancellationToken token) {
        Objects.requireNonNull(update, "Update is required");
        Objects.requireNonNull(token, "Token is required");
        if (!bound.compareAndSet(false, true)) {
            throw new IllegalStateException("Context is already bound, cannot bind update " + update.updateId());
        }
        this.update = update;
        this.token = token;
    }

    /**
     * Clears the update binding and detaches the scope. The scope itself is released by
     * whoever derived it.
     */
    void reset() {
        this.update = null;
        this.token = null;
        bound.set(false);
    }

    public boolean isBound() {
        return bound.get();
    }

    // ==================== ACCESSORS ====================

    public Update update() {
        requireBound();
        return update;
    }

    /**
     * Returns the message, edited message, channel post or edited channel post carried by
     * the update, in that order. Null for other update kinds.
     */
    public Message message() {
        return update().effectiveMessage();
    }

    public String command() {
        Message message = message();
        return message != null ? message.command() : "";
    }

    public String commandArguments() {
        Message message = message();
        return message != null ? message.commandArguments() : "";
    }

    public User sentFrom() {
        return update().sentFrom();
    }

    public Chat fromChat() {
        return update().fromChat();
    }

    public CancellationToken token() {
        requireBound();
        return token;
    }

    /**
     * Cooperative cancellation check for long-running handlers.
     */
    public boolean isCancelled() {
        return token().isCancelled();
    }

    public Optional<Instant> deadline() {
        return token().deadline();
    }

    public TelegramApi api() {
        return api;
    }

    // ==================== REPLIES ====================

    public Message replyText(String text, MessageOption... options) throws TelegramApiException {
        return reply(text, null, options);
    }

    public Message replyMarkdown(String text, MessageOption... options) throws TelegramApiException {
        return reply(text, SendMessage.MODE_MARKDOWN, options);
    }

    public Message replyHtml(String text, MessageOption... options) throws TelegramApiException {
        return reply(text, SendMessage.MODE_HTML, options);
    }

    private Message reply(String text, String parseMode, MessageOption... options) throws TelegramApiException {
        Chat chat = fromChat();
        if (chat == null) {
            throw new TelegramApiException("Update " + update.updateId() + " has no chat to reply to");
        }
        SendMessage message = SendMessage.of(chat.id(), text).withParseMode(parseMode);
        for (MessageOption option : options) {
            message = option.apply(message);
        }
        return api.send(message, token);
    }

    private void requireBound() {
        if (!bound.get()) {
            throw new IllegalStateException("Context is not bound to an update");
        }
    }

    @Override
    public String toString() {
        return "BotContext{" +
                "updateId=" + (update != null ? update.updateId() : "none") +
                ", token=" + token +
                '}';
    }
}
