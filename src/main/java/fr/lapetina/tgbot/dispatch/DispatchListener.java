package fr.lapetina.tgbot.dispatch;

import fr.lapetina.tgbot.dispatch.exception.DispatchException;
import fr.lapetina.tgbot.domain.command.Route;
import fr.lapetina.tgbot.domain.model.Update;

import java.time.Duration;

/**
 * Observer of dispatcher activity, used for metrics.
 *
 * Callbacks run on the poller and worker threads and must be fast and non-blocking.
 * All methods default to no-ops.
 */
public interface DispatchListener {

    DispatchListener NOOP = new DispatchListener() {
    };

    /** An update was accepted and published to the channel. */
    default void onUpdateReceived(Update update, long offset) {
    }

    /** An update below the watermark was dropped. */
    default void onDuplicateDropped(Update update, long offset) {
    }

    /** An update finished its execution lifecycle. */
    default void onUpdateHandled(Update update, Route route, Duration latency) {
    }

    /** An error was reported to the error handler. */
    default void onError(DispatchException error) {
    }
}
