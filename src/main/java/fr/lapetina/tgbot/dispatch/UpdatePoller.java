package fr.lapetina.tgbot.dispatch;

import fr.lapetina.tgbot.dispatch.exception.DispatchException;
import fr.lapetina.tgbot.dispatch.exception.DispatchException.ErrorKind;
import fr.lapetina.tgbot.domain.model.GetUpdatesRequest;
import fr.lapetina.tgbot.domain.model.Update;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApi;
import fr.lapetina.tgbot.infrastructure.telegram.TelegramApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Long-polls the Bot API and feeds the update channel.
 *
 * Owns the offset watermark: an update is published only if its id is at or above the
 * watermark, which then moves past it. Redelivered updates are dropped, so each update id
 * enters the channel at most once, in the order received.
 *
 * Fetch failures are reported as {@link ErrorKind#TRANSPORT} and retried after a fixed,
 * cancellable delay. Runs on a single thread until the token is cancelled.
 */
final class UpdatePoller implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(UpdatePoller.class);

    private final TelegramApi api;
    private final UpdateChannel channel;
    private final DispatcherConfig config;
    private final CancellationToken token;
    private final ErrorReporter reporter;

    // written by the poller thread only
    private volatile long offset;

    UpdatePoller(
            TelegramApi api,
            UpdateChannel channel,
            DispatcherConfig config,
            CancellationToken token,
            ErrorReporter reporter
    ) {
        this.api = api;
        this.channel = channel;
        this.config = config;
        this.token = token;
        this.reporter = reporter;
    }

    @Override
    public void run() {
        log.info("Update poller started: limit={}, pollTimeout={}s", config.getLimit(), config.getPollTimeoutSeconds());
        while (!token.isCancelled()) {
            List<Update> updates;
            try {
                updates = api.getUpdates(nextRequest(), token);
            } catch (TelegramApiException e) {
                if (token.isCancelled() || e.isCancelled()) {
                    break;
                }
                if (!fetchFailed(e)) {
                    break;
                }
                continue;
            } catch (RuntimeException e) {
                if (token.isCancelled() || !fetchFailed(e)) {
                    break;
                }
                continue;
            }

            if (updates != null && !enqueue(updates)) {
                break;
            }
        }
        log.info("Update poller stopped: offset={}", offset);
    }

    /**
     * Publishes a batch in received order.
     *
     * @return false if cancellation interrupted the batch
     */
    boolean enqueue(List<Update> updates) {
        for (Update update : updates) {
            if (update.updateId() < offset) {
                log.debug("Duplicate update dropped: updateId={}, offset={}", update.updateId(), offset);
                config.getListener().onDuplicateDropped(update, offset);
                continue;
            }
            if (!channel.publish(update, token)) {
                return false;
            }
            offset = update.updateId() + 1;
            config.getListener().onUpdateReceived(update, offset);
        }
        return true;
    }

    long offset() {
        return offset;
    }

    private GetUpdatesRequest nextRequest() {
        return new GetUpdatesRequest(offset, config.getLimit(), config.getPollTimeoutSeconds(), config.getAllowedUpdates());
    }

    /**
     * Reports the failure and waits out the retry delay.
     *
     * @return false if the dispatcher was stopped during the wait
     */
    private boolean fetchFailed(Exception e) {
        reporter.report(new DispatchException(ErrorKind.TRANSPORT, String.valueOf(e.getMessage()), e));
        try {
            return !token.await(config.getFetchRetryDelay());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
