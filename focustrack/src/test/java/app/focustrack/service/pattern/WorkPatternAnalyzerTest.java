package app.focustrack.service.pattern;

import app.focustrack.domain.activity.ActivityCategory;
import app.focustrack.domain.activity.ActivityEvent;
import app.focustrack.domain.activity.IdlePayload;
import app.focustrack.domain.activity.WindowPayload;
import app.focustrack.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class WorkPatternAnalyzerTest {

    private final MutableClock clock = MutableClock.at("2024-03-10T10:00:00Z");
    private final WorkPatternAnalyzer analyzer = new WorkPatternAnalyzer(clock);

    private ActivityEvent windowMinutesAgo(int minutes, String app) {
        return ActivityEvent.create(clock.millis() - minutes * 60_000L, ActivityCategory.WINDOW_CHANGE,
            new WindowPayload(app, "doc", app), "s-1");
    }

    @Test
    void testSteadyWindowActivityIsConsistent() {
        List<ActivityEvent> events = new ArrayList<>();
        for (int m = 10; m >= 0; m -= 2) {
            events.add(windowMinutesAgo(m, m == 10 ? "Terminal" : "Code"));
        }

        WorkAnalysis analysis = analyzer.hasBeenConsistentlyWorking(events, 10, 5);

        assertTrue(analysis.consistent());
        assertEquals(10, analysis.workDurationMinutes());
        assertEquals("Code", analysis.primaryActivity());
    }

    @Test
    void testLongIdleBreaksConsistency() {
        List<ActivityEvent> events = new ArrayList<>();
        events.add(windowMinutesAgo(9, "Code"));
        events.add(ActivityEvent.create(clock.millis() - 6 * 60_000L, ActivityCategory.IDLE,
            IdlePayload.entered(360), "s-1"));
        events.add(windowMinutesAgo(1, "Code"));

        WorkAnalysis analysis = analyzer.hasBeenConsistentlyWorking(events, 10, 5);

        assertFalse(analysis.consistent());
        assertEquals(WorkAnalysis.UNKNOWN_ACTIVITY, analysis.primaryActivity());
    }

    @Test
    void testGapsLongerThanAllowedDoNotCount() {
        List<ActivityEvent> events = List.of(windowMinutesAgo(10, "Code"), windowMinutesAgo(1, "Code"));

        WorkAnalysis analysis = analyzer.hasBeenConsistentlyWorking(events, 10, 5);

        assertFalse(analysis.consistent(), "A single 9 minute gap is not active time");
        assertEquals(0, analysis.workDurationMinutes());
        assertEquals("Code", analysis.primaryActivity());
    }

    @Test
    void testEventsOutsideWindowAreIgnored() {
        List<ActivityEvent> events = List.of(windowMinutesAgo(60, "Old"), windowMinutesAgo(58, "Old"));

        assertFalse(analyzer.hasBeenConsistentlyWorking(events, 10, 5).consistent());
    }

    @Test
    void testWorkPatternSessionsAndAppUsage() {
        List<ActivityEvent> events = new ArrayList<>();
        events.add(ActivityEvent.create(clock.millis() - 40 * 60_000L, ActivityCategory.IDLE,
            IdlePayload.entered(600), "s-1"));
        for (int m = 20; m >= 16; m -= 2) {
            events.add(windowMinutesAgo(m, "Code"));
        }
        events.add(windowMinutesAgo(14, "Browser"));
        events.add(ActivityEvent.create(clock.millis() - 10 * 60_000L, ActivityCategory.IDLE,
            IdlePayload.entered(120), "s-1"));
        events.add(windowMinutesAgo(5, "Code"));
        events.add(ActivityEvent.create(clock.millis() - 3 * 60_000L, ActivityCategory.IDLE,
            IdlePayload.entered(30), "s-1"));
        events.add(windowMinutesAgo(4, "Code"));

        WorkPattern pattern = analyzer.analyzeWorkPattern(events, 30);

        assertEquals(2, pattern.sessions().size(), "A nine minute gap splits the sessions");
        assertEquals(6.0, pattern.sessions().get(0).durationMinutes(), 1e-9);
        assertEquals(4, pattern.sessions().get(0).activityCount());
        assertEquals("Code", pattern.sessions().get(0).primaryApplication());
        assertEquals(7.0, pattern.totalWorkMinutes(), 1e-9);
        assertEquals(6.0, pattern.longestFocusStreakMinutes(), 1e-9);
        assertEquals(FocusQuality.EXCELLENT, pattern.focusQuality());

        assertEquals("Browser", pattern.mostUsedApps().get(0).application());
        assertEquals(9.0, pattern.mostUsedApps().get(0).durationMinutes(), 1e-9);
        assertEquals(56.25, pattern.mostUsedApps().get(0).percentage(), 1e-9);
        assertEquals(1, pattern.distractionEvents(), "Only idle periods over a minute inside the window count");
    }

    @Test
    void testWorkPatternWithoutWindowActivity() {
        WorkPattern pattern = analyzer.analyzeWorkPattern(List.of(), 30);

        assertTrue(pattern.sessions().isEmpty());
        assertTrue(pattern.mostUsedApps().isEmpty());
        assertEquals(FocusQuality.POOR, pattern.focusQuality());
    }

    @Test
    void testFocusQualityBands() {
        assertEquals(FocusQuality.EXCELLENT, FocusQuality.fromScore(0.8));
        assertEquals(FocusQuality.GOOD, FocusQuality.fromScore(0.6));
        assertEquals(FocusQuality.FAIR, FocusQuality.fromScore(0.4));
        assertEquals(FocusQuality.POOR, FocusQuality.fromScore(0.39));
        assertEquals("excellent", FocusQuality.EXCELLENT.wireValue());
    }

    @Test
    void testEncouragementForLongStreakFollowsFocusQuality() {
        WorkPatternAnalyzer seeded = new WorkPatternAnalyzer(clock, new Random(7));

        assertTrue(WorkPatternAnalyzer.LONG_FOCUS_EXCELLENT.contains(
            seeded.encouragementMessage(pattern(FocusQuality.EXCELLENT, List.of(), 0), 75)));
        assertTrue(WorkPatternAnalyzer.LONG_FOCUS_GOOD.contains(
            seeded.encouragementMessage(pattern(FocusQuality.GOOD, List.of(), 0), 75)));
        assertTrue(WorkPatternAnalyzer.LONG_FOCUS_GOOD.contains(
            seeded.encouragementMessage(pattern(FocusQuality.POOR, List.of(), 0), 60)));
    }

    @Test
    void testEncouragementForMediumStreakNamesTopApp() {
        WorkPatternAnalyzer seeded = new WorkPatternAnalyzer(clock, new Random(7));

        String withApp = seeded.encouragementMessage(
            pattern(FocusQuality.GOOD, List.of(new AppUsage("IntelliJ", 30, 100)), 0), 40);
        String withoutApp = seeded.encouragementMessage(pattern(FocusQuality.GOOD, List.of(), 0), 30);

        assertTrue(withApp.contains("IntelliJ"), withApp);
        assertFalse(withApp.contains("{app}"), withApp);
        assertTrue(withoutApp.contains("your current task"), withoutApp);
    }

    @Test
    void testEncouragementForShortStreakFollowsDistractions() {
        WorkPatternAnalyzer seeded = new WorkPatternAnalyzer(clock, new Random(7));

        assertTrue(WorkPatternAnalyzer.SHORT_FOCUS_CLEAN.contains(
            seeded.encouragementMessage(pattern(FocusQuality.EXCELLENT, List.of(), 0), 20)));
        assertTrue(WorkPatternAnalyzer.SHORT_FOCUS_DISTRACTED.contains(
            seeded.encouragementMessage(pattern(FocusQuality.EXCELLENT, List.of(), 2), 29)));
    }

    private static WorkPattern pattern(FocusQuality quality, List<AppUsage> apps, int distractions) {
        return new WorkPattern(0, List.of(), apps, quality, distractions, 0);
    }
}
