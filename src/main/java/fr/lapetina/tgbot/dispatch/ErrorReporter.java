package fr.lapetina.tgbot.dispatch;

import fr.lapetina.tgbot.dispatch.exception.DispatchException;
import fr.lapetina.tgbot.domain.command.ErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single funnel for runtime errors: the configured {@link ErrorHandler} first, then the
 * listener. A failure in either is logged and never reaches the caller.
 */
final class ErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ErrorReporter.class);

    private final ErrorHandler errorHandler;
    private final DispatchListener listener;

    ErrorReporter(ErrorHandler errorHandler, DispatchListener listener) {
        this.errorHandler = errorHandler;
        this.listener = listener;
    }

    ErrorReporter(DispatcherConfig config) {
        this(config.getErrorHandler(), config.getListener());
    }

    void report(DispatchException error) {
        try {
            errorHandler.onError(error);
        } catch (RuntimeException e) {
            log.error("Error handler failed: kind={}, updateId={}", error.getKind(), error.getUpdateId(), e);
        }
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            log.warn("Listener failed on error: kind={}", error.getKind(), e);
        }
    }
}
