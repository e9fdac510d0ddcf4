package fr.lapetina.tgbot.dispatch;

/**
 * Lifecycle state of an {@link UpdateDispatcher}.
 */
public enum DispatcherState {
    /** Built, commands may still be registered */
    CONFIGURED,

    /** Workers and poller running */
    RUNNING,

    /** Cancellation signalled, waiting for workers and poller to exit */
    STOPPING,

    /** Everything exited; the dispatcher cannot be restarted */
    STOPPED
}
