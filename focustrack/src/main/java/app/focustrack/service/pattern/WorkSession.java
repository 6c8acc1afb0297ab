package app.focustrack.service.pattern;

import java.util.List;

/**
 * Run of window changes with no gap longer than the session break.
 *
 * @param focusScore 0..1, window changes per five minutes of session time, capped at 1
 */
public record WorkSession(
    long startTime,
    long endTime,
    double durationMinutes,
    String primaryApplication,
    List<String> windowTitles,
    int activityCount,
    double focusScore
) {
    public WorkSession {
        windowTitles = List.copyOf(windowTitles);
    }
}
