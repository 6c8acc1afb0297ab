package app.focustrack.domain.decision;

import app.focustrack.domain.activity.ActivityEvent;
import app.focustrack.domain.activity.WindowPayload;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input to a decision provider: idle duration plus a bounded summary of recent activity.
 */
public record DecisionContext(
    long idleDurationSeconds,
    List<WindowPayload> recentWindows,  // most recent last, at most MAX_RECENT_WINDOWS
    long sessionDurationMillis,
    int windowChangeCount,
    String mostUsedApp
) {
    public static final int MAX_RECENT_WINDOWS = 5;
    public static final String UNKNOWN_APP = "Unknown";

    public DecisionContext {
        recentWindows = recentWindows == null ? List.of() : List.copyOf(recentWindows);
        mostUsedApp = mostUsedApp == null ? UNKNOWN_APP : mostUsedApp;
    }

    /**
     * Context with no activity history, e.g. when the event log is unavailable.
     */
    public static DecisionContext idleOnly(long idleDurationSeconds) {
        return new DecisionContext(idleDurationSeconds, List.of(), 0, 0, UNKNOWN_APP);
    }

    /**
     * Summarize a window of events (expected in ascending timestamp order).
     */
    public static DecisionContext fromEvents(long idleDurationSeconds, List<ActivityEvent> events) {
        if (events == null || events.isEmpty()) {
            return idleOnly(idleDurationSeconds);
        }

        long first = Long.MAX_VALUE;
        long last = Long.MIN_VALUE;
        List<WindowPayload> windows = new ArrayList<>();
        Map<String, Integer> appCounts = new LinkedHashMap<>();

        for (ActivityEvent event : events) {
            first = Math.min(first, event.timestamp());
            last = Math.max(last, event.timestamp());
            if (!event.isWindowChange()) {
                continue;
            }
            WindowPayload window;
            try {
                window = event.payloadAs(WindowPayload.class);
            } catch (IllegalArgumentException e) {
                continue;
            }
            windows.add(window);
            appCounts.merge(window.applicationName(), 1, Integer::sum);
        }

        String mostUsed = UNKNOWN_APP;
        int best = 0;
        for (Map.Entry<String, Integer> entry : appCounts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mostUsed = entry.getKey();
            }
        }

        List<WindowPayload> recent = windows.size() > MAX_RECENT_WINDOWS
            ? windows.subList(windows.size() - MAX_RECENT_WINDOWS, windows.size())
            : windows;

        return new DecisionContext(idleDurationSeconds, recent, last - first, windows.size(), mostUsed);
    }
}
