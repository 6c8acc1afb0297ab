package app.focustrack.infrastructure.scheduling;

import java.time.Duration;

/**
 * Repeating-timer abstraction. Keeps timer mechanics out of the components
 * whose transition logic they drive.
 */
public interface TaskScheduler {

    /**
     * Run {@code task} every {@code period}, first after {@code initialDelay}.
     * An exception thrown by one run does not cancel later runs.
     *
     * @param name task name used in logs
     */
    ScheduledTask scheduleAtFixedRate(String name, Runnable task, Duration initialDelay, Duration period);
}
