package app.focustrack.service.pattern;

import app.focustrack.domain.activity.ActivityEvent;
import app.focustrack.domain.activity.IdlePayload;
import app.focustrack.domain.activity.WindowPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Work pattern analysis over the recent event history.
 *
 * A window counts as consistent work when it holds no idle entry longer than
 * the allowed gap and the active time adds up to at least half the window.
 * The pattern summary (sessions, app usage, focus quality, distractions)
 * picks the encouragement message for a streak.
 */
public final class WorkPatternAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(WorkPatternAnalyzer.class);

    public static final int DEFAULT_MAX_IDLE_GAP_MINUTES = 5;

    // Idle entries longer than this count as distractions
    private static final long DISTRACTION_IDLE_SECONDS = 60;
    private static final long SESSION_BREAK_MS = TimeUnit.MINUTES.toMillis(5);

    static final List<String> LONG_FOCUS_EXCELLENT = List.of(
        "Incredible focus! You've been in the zone for over an hour. Your dedication is paying off! 🔥",
        "Amazing work! You're showing exceptional focus and concentration. Keep this momentum going! ⭐",
        "Outstanding! You've maintained deep focus for an extended period. This is how great work gets done! 🎯",
        "Phenomenal concentration! You're in a state of flow that many people struggle to achieve. Brilliant! 💎");
    static final List<String> LONG_FOCUS_GOOD = List.of(
        "Great job staying focused for over an hour! You're building excellent work habits. 💪",
        "Solid work session! You've shown real commitment to your tasks. Keep it up! 🚀",
        "Nice focus streak! An hour of dedicated work is something to be proud of. 👏",
        "Well done! You've demonstrated strong concentration skills. Your effort shows! ✨");
    static final List<String> MEDIUM_FOCUS = List.of(
        "Good work on {app}! You're maintaining steady focus. Keep the momentum going! 📈",
        "Nice progress on {app}! You've been consistently working for a solid stretch. 🎯",
        "Great focus on {app}! You're showing good concentration on your current task. 💡",
        "Steady work on {app}! You're building good focus habits with this session. 🌟");
    static final List<String> SHORT_FOCUS_CLEAN = List.of(
        "Clean focus session! No distractions detected. You're developing great concentration! 🎯",
        "Perfect! You've maintained focus without any interruptions. Excellent self-discipline! ⚡",
        "Distraction-free work! This is exactly how to build strong focus muscles. 💪",
        "Great job! You stayed on task without getting sidetracked. Keep this up! 🎪");
    static final List<String> SHORT_FOCUS_DISTRACTED = List.of(
        "Good work! You got back on track after some distractions. That's real focus skill! 🔄",
        "Nice recovery! Managing distractions and returning to work shows maturity. 🎯",
        "Well done! You didn't let interruptions derail your progress completely. 💪",
        "Good focus management! You're learning to handle distractions effectively. 📚");

    private final Clock clock;
    private final Random random;

    public WorkPatternAnalyzer(Clock clock) {
        this(clock, new Random());
    }

    WorkPatternAnalyzer(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // CONSISTENT WORK
    // ═══════════════════════════════════════════════════════════════════════════

    public WorkAnalysis hasBeenConsistentlyWorking(List<ActivityEvent> events, int thresholdMinutes,
                                                   int maxIdleGapMinutes) {
        long now = clock.millis();
        long thresholdMs = TimeUnit.MINUTES.toMillis(thresholdMinutes);
        long maxGapMs = TimeUnit.MINUTES.toMillis(maxIdleGapMinutes);

        List<ActivityEvent> recent = new ArrayList<>();
        for (ActivityEvent event : events) {
            if (now - event.timestamp() <= thresholdMs) {
                recent.add(event);
            }
        }
        if (recent.isEmpty()) {
            return WorkAnalysis.none();
        }
        recent.sort(Comparator.comparingLong(ActivityEvent::timestamp));

        for (ActivityEvent event : recent) {
            if (!event.isIdle()) {
                continue;
            }
            IdlePayload idle = readIdle(event);
            if (idle != null && idle.wasIdle() && idle.idleDuration() > TimeUnit.MILLISECONDS.toSeconds(maxGapMs)) {
                log.debug("[WORK] Long idle period of {}s in the last {} minutes", idle.idleDuration(), thresholdMinutes);
                return WorkAnalysis.none();
            }
        }

        long activeMs = 0;
        for (int i = 1; i < recent.size(); i++) {
            long gap = recent.get(i).timestamp() - recent.get(i - 1).timestamp();
            if (gap <= maxGapMs) {
                activeMs += gap;
            }
        }
        long workMinutes = TimeUnit.MILLISECONDS.toMinutes(activeMs);
        boolean consistent = activeMs * 2 >= thresholdMs;

        return new WorkAnalysis(consistent, workMinutes, primaryActivity(recent));
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // WORK PATTERN
    // ═══════════════════════════════════════════════════════════════════════════

    /**
     * Summarize the window changes and idle periods of the last {@code windowMinutes}.
     */
    public WorkPattern analyzeWorkPattern(List<ActivityEvent> events, int windowMinutes) {
        long now = clock.millis();
        long windowMs = TimeUnit.MINUTES.toMillis(windowMinutes);

        List<ActivityEvent> windowEvents = new ArrayList<>();
        int distractions = 0;
        for (ActivityEvent event : events) {
            if (now - event.timestamp() > windowMs) {
                continue;
            }
            if (event.isWindowChange()) {
                windowEvents.add(event);
            } else if (event.isIdle()) {
                IdlePayload idle = readIdle(event);
                if (idle != null && idle.wasIdle() && idle.idleDuration() > DISTRACTION_IDLE_SECONDS) {
                    distractions++;
                }
            }
        }
        windowEvents.sort(Comparator.comparingLong(ActivityEvent::timestamp));

        List<WorkSession> sessions = extractSessions(windowEvents);
        double total = 0;
        double longest = 0;
        double scoreSum = 0;
        for (WorkSession session : sessions) {
            total += session.durationMinutes();
            longest = Math.max(longest, session.durationMinutes());
            scoreSum += session.focusScore();
        }
        double averageScore = sessions.isEmpty() ? 0 : scoreSum / sessions.size();

        return new WorkPattern(total, sessions, appUsage(windowEvents),
            FocusQuality.fromScore(averageScore), distractions, longest);
    }

    /**
     * Positive-reinforcement text for a work streak, picked by streak length
     * and by the quality of the recent pattern.
     */
    public String encouragementMessage(WorkPattern pattern, long workMinutes) {
        if (workMinutes >= 60) {
            return pick(pattern.focusQuality() == FocusQuality.EXCELLENT ? LONG_FOCUS_EXCELLENT : LONG_FOCUS_GOOD);
        }
        if (workMinutes >= 30) {
            String app = pattern.mostUsedApps().isEmpty()
                ? "your current task"
                : pattern.mostUsedApps().get(0).application();
            return pick(MEDIUM_FOCUS).replace("{app}", app);
        }
        return pick(pattern.distractionEvents() == 0 ? SHORT_FOCUS_CLEAN : SHORT_FOCUS_DISTRACTED);
    }

    private List<WorkSession> extractSessions(List<ActivityEvent> sortedWindowEvents) {
        List<WorkSession> sessions = new ArrayList<>();
        long start = 0;
        long end = 0;
        String app = null;
        List<String> titles = new ArrayList<>();
        int count = 0;

        for (ActivityEvent event : sortedWindowEvents) {
            WindowPayload window = readWindow(event);
            if (window == null) {
                continue;
            }
            if (count == 0 || event.timestamp() - end > SESSION_BREAK_MS) {
                if (count > 0) {
                    sessions.add(finishSession(start, end, app, titles, count));
                }
                start = event.timestamp();
                app = orUnknown(window.applicationName());
                titles = new ArrayList<>();
                count = 0;
            }
            end = event.timestamp();
            count++;
            String title = orUnknown(window.windowTitle());
            if (!titles.contains(title)) {
                titles.add(title);
            }
        }
        if (count > 0) {
            sessions.add(finishSession(start, end, app, titles, count));
        }
        return sessions;
    }

    private static WorkSession finishSession(long start, long end, String app, List<String> titles, int count) {
        double minutes = (end - start) / 60_000.0;
        double focusScore = Math.min(1.0, count / Math.max(1.0, minutes / 5));
        return new WorkSession(start, end, minutes, app, titles, count, focusScore);
    }

    private List<AppUsage> appUsage(List<ActivityEvent> sortedWindowEvents) {
        Map<String, Double> minutesByApp = new LinkedHashMap<>();
        String lastApp = null;
        long lastTimestamp = 0;
        for (ActivityEvent event : sortedWindowEvents) {
            WindowPayload window = readWindow(event);
            if (window == null) {
                continue;
            }
            if (lastApp != null) {
                minutesByApp.merge(lastApp, (event.timestamp() - lastTimestamp) / 60_000.0, Double::sum);
            }
            lastApp = orUnknown(window.applicationName());
            lastTimestamp = event.timestamp();
        }

        double total = 0;
        for (double minutes : minutesByApp.values()) {
            total += minutes;
        }
        List<AppUsage> usage = new ArrayList<>();
        for (Map.Entry<String, Double> entry : minutesByApp.entrySet()) {
            double percentage = total > 0 ? entry.getValue() / total * 100 : 0;
            usage.add(new AppUsage(entry.getKey(), entry.getValue(), percentage));
        }
        usage.sort(Comparator.comparingDouble(AppUsage::durationMinutes).reversed());
        return usage;
    }

    private String pick(List<String> messages) {
        return messages.get(random.nextInt(messages.size()));
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "Unknown" : value;
    }

    private WindowPayload readWindow(ActivityEvent event) {
        try {
            return event.payloadAs(WindowPayload.class);
        } catch (IllegalArgumentException e) {
            log.debug("[WORK] Skipping unreadable window event {}", event.id());
            return null;
        }
    }

    private String primaryActivity(List<ActivityEvent> events) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ActivityEvent event : events) {
            if (!event.isWindowChange()) {
                continue;
            }
            try {
                counts.merge(event.payloadAs(WindowPayload.class).applicationName(), 1, Integer::sum);
            } catch (IllegalArgumentException e) {
                log.debug("[WORK] Skipping unreadable window event {}", event.id());
            }
        }

        String best = WorkAnalysis.UNKNOWN_ACTIVITY;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                bestCount = entry.getValue();
                best = entry.getKey();
            }
        }
        return best;
    }

    private IdlePayload readIdle(ActivityEvent event) {
        try {
            return event.payloadAs(IdlePayload.class);
        } catch (IllegalArgumentException e) {
            log.debug("[WORK] Skipping unreadable idle event {}", event.id());
            return null;
        }
    }
}
