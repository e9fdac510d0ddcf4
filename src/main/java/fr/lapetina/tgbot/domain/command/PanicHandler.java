package fr.lapetina.tgbot.domain.command;

/**
 * Converts a recovered panic into the message replied to the user.
 */
@FunctionalInterface
public interface PanicHandler {

    /**
     * @param panic the throwable that escaped the handler
     * @return the reply text, or null or empty to reply nothing
     */
    String onPanic(Throwable panic);
}
