package app.focustrack.service.pattern;

/**
 * Outcome of a consistent-work check.
 *
 * @param consistent          true if the user has been working without long breaks
 * @param workDurationMinutes active minutes within the checked window
 * @param primaryActivity     most frequent application in the window
 */
public record WorkAnalysis(
    boolean consistent,
    long workDurationMinutes,
    String primaryActivity
) {
    public static final String UNKNOWN_ACTIVITY = "unknown";

    public static WorkAnalysis none() {
        return new WorkAnalysis(false, 0, UNKNOWN_ACTIVITY);
    }
}
