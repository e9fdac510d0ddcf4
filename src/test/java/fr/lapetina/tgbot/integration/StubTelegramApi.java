package fr.lapetina.tgbot.integration;

import fr.lapetina.tgbot.dispatch.CancellationToken;
import fr.lapetina.tgbot.domain.model.BotCommand;
import fr.lapetina.tgbot.domain.model.Chat;
import fr.lapetina.tgbot.domain.model.GetUpdatesRequest;
import fr.lapetina.tgbot.domain.model.Message;
import fr.lapetina.tgbot.domain.model.SendMessage;
import fr.lapetina.tgbot.domain.model.Update;
import fr.lapetina.tgbot.domain.model.User;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApi;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApiException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scripted Bot API for tests.
 *
 * {@code getUpdates} returns the queued batches in order, regardless of the requested
 * offset, so redelivery can be simulated. With nothing queued it behaves like a short long
 * poll: waits a little, then returns an empty batch. Sent messages and requests are recorded.
 */
public class StubTelegramApi implements TelegramApi {

    private static final long IDLE_POLL_MILLIS = 20;

    private final BlockingQueue<Object> script = new LinkedBlockingQueue<>();
    private final List<GetUpdatesRequest> requests = new CopyOnWriteArrayList<>();
    private final List<SendMessage> sent = new CopyOnWriteArrayList<>();
    private final List<List<BotCommand>> publishedMenus = new CopyOnWriteArrayList<>();
    private final AtomicLong messageIds = new AtomicLong(1000);

    private volatile TelegramApiException setMyCommandsFailure;
    private volatile TelegramApiException sendFailure;

    // ==================== SCRIPT ====================

    public StubTelegramApi enqueueBatch(Update... updates) {
        script.add(new ArrayList<>(Arrays.asList(updates)));
        return this;
    }

    public StubTelegramApi enqueueFailure(TelegramApiException failure) {
        script.add(failure);
        return this;
    }

    public void failSetMyCommands(TelegramApiException failure) {
        this.setMyCommandsFailure = failure;
    }

    public void failSend(TelegramApiException failure) {
        this.sendFailure = failure;
    }

    // ==================== API ====================

    @Override
    @SuppressWarnings("unchecked")
    public List<Update> getUpdates(GetUpdatesRequest request, CancellationToken token) throws TelegramApiException {
        requests.add(request);
        if (token.isCancelled()) {
            throw TelegramApiException.cancelled("getUpdates", null);
        }
        Object next;
        try {
            next = script.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TelegramApiException.cancelled("getUpdates", e);
        }
        if (next == null) {
            if (token.isCancelled()) {
                throw TelegramApiException.cancelled("getUpdates", null);
            }
            return List.of();
        }
        if (next instanceof TelegramApiException) {
            throw (TelegramApiException) next;
        }
        return (List<Update>) next;
    }

    @Override
    public void setMyCommands(List<BotCommand> commands, CancellationToken token) throws TelegramApiException {
        if (setMyCommandsFailure != null) {
            throw setMyCommandsFailure;
        }
        publishedMenus.add(List.copyOf(commands));
    }

    @Override
    public Message send(SendMessage message, CancellationToken token) throws TelegramApiException {
        if (token.isCancelled()) {
            throw TelegramApiException.cancelled("sendMessage", null);
        }
        if (sendFailure != null) {
            throw sendFailure;
        }
        sent.add(message);
        return Message.ofText(messageIds.incrementAndGet(), Chat.ofPrivate(message.chatId()), null, message.text());
    }

    // ==================== RECORDINGS ====================

    public List<GetUpdatesRequest> requests() {
        return requests;
    }

    public List<SendMessage> sent() {
        return sent;
    }

    public List<String> sentTexts() {
        return sent.stream().map(SendMessage::text).toList();
    }

    public List<List<BotCommand>> publishedMenus() {
        return publishedMenus;
    }

    public boolean scriptConsumed() {
        return script.isEmpty();
    }

    /**
     * Waits until at least {@code count} messages were sent.
     */
    public boolean awaitSent(int count, Duration maxWait) throws InterruptedException {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (sent.size() < count) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    // ==================== FIXTURES ====================

    public static final User ALICE = new User(42L, false, "Alice", null, "alice");

    public static Update textUpdate(long updateId, long chatId, String text) {
        return Update.ofMessage(updateId, Message.ofText(updateId * 10, Chat.ofPrivate(chatId), ALICE, text));
    }
}
