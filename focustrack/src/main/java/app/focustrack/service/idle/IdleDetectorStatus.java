package app.focustrack.service.idle;

/**
 * Read-only view of an {@link IdleDetector}.
 */
public record IdleDetectorStatus(
    boolean running,
    boolean idle,
    long lastActivityTime,
    long thresholdSeconds
) {
}
