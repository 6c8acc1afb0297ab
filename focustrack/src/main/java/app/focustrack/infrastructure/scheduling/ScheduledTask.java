package app.focustrack.infrastructure.scheduling;

/**
 * Cancellation handle for a repeating task. Cancelling twice is a no-op.
 */
public interface ScheduledTask {

    void cancel();

    boolean isCancelled();
}
