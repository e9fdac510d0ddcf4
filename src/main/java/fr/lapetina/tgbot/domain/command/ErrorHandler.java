package fr.lapetina.tgbot.domain.command;

import fr.lapetina.tgbot.dispatch.exception.DispatchException;

/**
 * Receives every error the dispatcher does not propagate: transport failures,
 * handler errors, panics, failed replies and executor rejections.
 *
 * Called concurrently from the poller and the worker threads.
 */
@FunctionalInterface
public interface ErrorHandler {

    void onError(DispatchException error);
}
