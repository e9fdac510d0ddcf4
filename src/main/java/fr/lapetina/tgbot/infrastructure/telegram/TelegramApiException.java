package fr.lapetina.tgbot.infrastructure.telegram;

/**
 * Failure of a Bot API call: transport error, HTTP error, {@code ok=false} response,
 * or cancellation of the calling scope.
 */
public class TelegramApiException extends Exception {

    private final int errorCode;
    private final boolean cancelled;

    public TelegramApiException(String message) {
        this(message, 0, null, false);
    }

    public TelegramApiException(String message, Throwable cause) {
        this(message, 0, cause, false);
    }

    public TelegramApiException(String message, int errorCode) {
        this(message, errorCode, null, false);
    }

    private TelegramApiException(String message, int errorCode, Throwable cause, boolean cancelled) {
        super(message, cause);
        this.errorCode = errorCode;
        this.cancelled = cancelled;
    }

    /**
     * Creates the exception thrown when the caller's cancellation token fired mid-call.
     */
    public static TelegramApiException cancelled(String method, Throwable cause) {
        return new TelegramApiException("Request cancelled: " + method, 0, cause, true);
    }

    /**
     * Returns the Bot API {@code error_code} or HTTP status, 0 when unknown.
     */
    public int getErrorCode() {
        return errorCode;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
