package fr.lapetina.tgbot.domain.command;

/**
 * Where the router sent an update.
 */
public enum Route {
    /** Command with a registered handler */
    COMMAND,

    /** Command without a handler, sent to the fallback */
    UNDEFINED_COMMAND,

    /** Non-command update sent to the catch-all handler */
    UPDATE,

    /** Non-command update and no catch-all handler configured */
    IGNORED
}
