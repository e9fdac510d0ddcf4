package fr.lapetina.tgbot.dispatch.exception;

/**
 * Error reported by the dispatcher to the configured error handler.
 *
 * Every failure below the worker boundary is wrapped in one of these and funneled
 * through a single {@code ErrorHandler}; only {@link ErrorKind#STARTUP} is ever thrown
 * to the caller.
 */
public final class DispatchException extends RuntimeException {

    private final ErrorKind kind;
    private final long updateId;

    public DispatchException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, -1);
    }

    public DispatchException(ErrorKind kind, String message, Throwable cause, long updateId) {
        super(kind.getMessage() + ": " + message, cause);
        this.kind = kind;
        this.updateId = updateId;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the id of the update being handled, or -1 when the error is not tied to one.
     */
    public long getUpdateId() {
        return updateId;
    }

    public enum ErrorKind {
        TRANSPORT("Failed to get updates"),
        HANDLER("Handler returned an error"),
        PANIC("Handler panicked"),
        STARTUP("Failed to set up the bot"),
        REPLY("Failed to send reply"),
        REJECTED("Executor rejected the update, running inline");

        private final String message;

        ErrorKind(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
