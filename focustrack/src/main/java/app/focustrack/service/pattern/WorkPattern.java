package app.focustrack.service.pattern;

import java.util.List;

/**
 * Shape of recent work: sessions, application usage and focus quality.
 *
 * @param mostUsedApps              sorted by duration, longest first
 * @param distractionEvents         idle entries longer than a minute
 * @param longestFocusStreakMinutes longest single session
 */
public record WorkPattern(
    double totalWorkMinutes,
    List<WorkSession> sessions,
    List<AppUsage> mostUsedApps,
    FocusQuality focusQuality,
    int distractionEvents,
    double longestFocusStreakMinutes
) {
    public WorkPattern {
        sessions = List.copyOf(sessions);
        mostUsedApps = List.copyOf(mostUsedApps);
    }

    public static WorkPattern empty() {
        return new WorkPattern(0, List.of(), List.of(), FocusQuality.POOR, 0, 0);
    }
}
