package app.focustrack.service.idle;

import app.focustrack.domain.activity.ActivityCategory;
import app.focustrack.domain.activity.ActivityEvent;
import app.focustrack.domain.activity.IdlePayload;
import app.focustrack.domain.activity.ResumeTrigger;
import app.focustrack.infrastructure.persistence.JsonlEventStore;
import app.focustrack.infrastructure.power.ResumeSignalSource;
import app.focustrack.support.ManualTaskScheduler;
import app.focustrack.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IdleDetector.
 *
 * Tests:
 * - Exactly one entry and one exit event per idle period
 * - Lifecycle (double stop, stop before start)
 * - Resume-from-suspend handling
 * - Threshold updates
 */
class IdleDetectorTest {

    @TempDir
    Path storageDir;

    private final MutableClock clock = MutableClock.at("2024-03-10T09:00:00Z");
    private final ManualTaskScheduler scheduler = new ManualTaskScheduler();
    private final List<Runnable> resumeCallbacks = new CopyOnWriteArrayList<>();
    private final ResumeSignalSource resumeSource = callback -> {
        resumeCallbacks.add(callback);
        return () -> resumeCallbacks.remove(callback);
    };

    private JsonlEventStore store;
    private IdleDetector detector;
    private final List<IdleTransition> transitions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new JsonlEventStore(storageDir, 100, clock, Runnable::run);
        detector = new IdleDetector(store, scheduler, resumeSource, clock, 5, Duration.ofSeconds(1));
        detector.addListener(transitions::add);
    }

    @AfterEach
    void tearDown() {
        detector.stop();
        store.shutdown();
    }

    private List<IdlePayload> idleEvents() {
        return store.queryRecent(60).stream()
            .filter(ActivityEvent::isIdle)
            .map(e -> e.payloadAs(IdlePayload.class))
            .collect(Collectors.toList());
    }

    @Test
    void testSingleEntryAndExitForOneIdlePeriod() {
        detector.start();

        for (int i = 0; i < 6; i++) {
            clock.advance(Duration.ofSeconds(1));
            scheduler.run("idle-check");
        }
        // Further polls while idle add nothing
        clock.advance(Duration.ofSeconds(3));
        scheduler.run("idle-check");

        detector.notifyActivity(ResumeTrigger.KEYBOARD);
        detector.notifyActivity(ResumeTrigger.KEYBOARD);

        List<IdlePayload> events = idleEvents();
        assertEquals(2, events.size(), "One entry and one exit event");

        IdlePayload entry = events.get(0);
        assertTrue(entry.wasIdle());
        assertTrue(entry.idleDuration() >= 5);

        IdlePayload exit = events.get(1);
        assertFalse(exit.wasIdle());
        assertEquals(ResumeTrigger.KEYBOARD, exit.resumeTrigger());
        assertEquals(9, exit.idleDuration());

        assertEquals(2, transitions.size());
        assertTrue(transitions.get(0).enteredIdle());
        assertFalse(transitions.get(1).enteredIdle());
    }

    @Test
    void testActivityPostponesIdleEntry() {
        detector.start();

        clock.advance(Duration.ofSeconds(4));
        detector.notifyActivity(ResumeTrigger.MOUSE);
        clock.advance(Duration.ofSeconds(4));
        scheduler.run("idle-check");

        assertTrue(idleEvents().isEmpty());
        assertFalse(detector.status().idle());
    }

    @Test
    void testDoubleStopIsNoOp() {
        detector.start();
        assertEquals(1, scheduler.activeCount("idle-check"));

        detector.stop();
        detector.stop();

        assertEquals(0, scheduler.activeCount("idle-check"));
        assertTrue(resumeCallbacks.isEmpty());
        assertFalse(detector.status().running());
    }

    @Test
    void testStopBeforeStartIsNoOp() {
        detector.stop();

        assertFalse(detector.status().running());
        assertEquals(0, scheduler.activeCount("idle-check"));
    }

    @Test
    void testStartTwiceSchedulesOnce() {
        detector.start();
        detector.start();

        assertEquals(1, scheduler.activeCount("idle-check"));
        assertEquals(1, resumeCallbacks.size());
    }

    @Test
    void testNoChecksAfterStop() {
        detector.start();
        detector.stop();

        clock.advance(Duration.ofSeconds(10));
        detector.checkNow();

        assertTrue(idleEvents().isEmpty());
    }

    @Test
    void testResumeFromSuspendRecordsEntryThenExit() {
        detector.start();

        // Suspended for an hour: no timer ran
        clock.advance(Duration.ofHours(1));
        resumeCallbacks.forEach(Runnable::run);

        List<IdlePayload> events = idleEvents();
        assertEquals(2, events.size());
        assertTrue(events.get(0).wasIdle());
        assertEquals(3600, events.get(0).idleDuration());
        assertFalse(events.get(1).wasIdle());
        assertEquals(ResumeTrigger.UNKNOWN, events.get(1).resumeTrigger());
        assertFalse(detector.status().idle());
    }

    @Test
    void testUpdateThresholdAppliesToNextCheck() {
        detector.start();
        detector.updateThreshold(60);

        clock.advance(Duration.ofSeconds(30));
        scheduler.run("idle-check");
        assertFalse(detector.status().idle());
        assertEquals(60, detector.status().thresholdSeconds());

        clock.advance(Duration.ofSeconds(30));
        scheduler.run("idle-check");
        assertTrue(detector.status().idle());
    }

    @Test
    void testEventsAreRecordedUnderIdleCategory() {
        detector.start();
        clock.advance(Duration.ofSeconds(6));
        scheduler.run("idle-check");

        List<ActivityEvent> events = store.queryRecent(60);
        assertEquals(1, events.size());
        assertEquals(ActivityCategory.IDLE, events.get(0).category());
        assertEquals(store.sessionId(), events.get(0).sessionId());
    }
}
