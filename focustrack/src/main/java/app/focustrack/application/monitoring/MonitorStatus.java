package app.focustrack.application.monitoring;

/**
 * Snapshot of the monitor for a settings or status surface.
 */
public record MonitorStatus(
    boolean running,
    boolean idle,
    long lastActivityTime,
    long idleThresholdSeconds,
    String provider,
    String sessionId,
    int bufferedEvents
) {
}
