package app.focustrack.application.monitoring;

import app.focustrack.application.port.output.EventStore;
import app.focustrack.application.port.output.NotificationDispatcher;
import app.focustrack.config.DecisionTrigger;
import app.focustrack.config.MonitorConfig;
import app.focustrack.domain.activity.ActivityCategory;
import app.focustrack.domain.activity.ActivityEvent;
import app.focustrack.domain.activity.ResumeTrigger;
import app.focustrack.domain.activity.WindowPayload;
import app.focustrack.domain.decision.DecisionContext;
import app.focustrack.domain.decision.DecisionVerdict;
import app.focustrack.domain.notification.Notification;
import app.focustrack.domain.notification.NotificationCategory;
import app.focustrack.domain.notification.NotificationInteraction;
import app.focustrack.service.decision.DecisionService;
import app.focustrack.service.idle.IdleTransition;
import app.focustrack.service.notification.NotificationGate;
import app.focustrack.service.pattern.WorkPatternAnalyzer;
import app.focustrack.support.ManualTaskScheduler;
import app.focustrack.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FocusMonitor.
 *
 * Tests:
 * - Idle entry leads to gate check, decision, record, event and dispatch
 * - Cooldown and negative verdicts stop the flow
 * - Decision trigger selection
 * - Good-job work check
 * - Failure isolation (history, dispatcher)
 */
@ExtendWith(MockitoExtension.class)
class FocusMonitorTest {

    private static final String FOCUS_MESSAGE = "Long break detected! Ready to refocus and tackle your goals? 🚀";

    @Mock
    private EventStore eventStore;
    @Mock
    private NotificationGate gate;
    @Mock
    private DecisionService decisionService;
    @Mock
    private NotificationDispatcher dispatcher;

    private final MutableClock clock = MutableClock.at("2024-03-10T10:00:00Z");
    private final ManualTaskScheduler scheduler = new ManualTaskScheduler();
    private MonitorConfig config;

    @BeforeEach
    void setUp() {
        config = MonitorConfig.defaults(Path.of("unused"));
    }

    private FocusMonitor newMonitor(MonitorConfig monitorConfig) {
        return new FocusMonitor(eventStore, gate, decisionService, dispatcher,
            new WorkPatternAnalyzer(clock), scheduler, monitorConfig, Runnable::run);
    }

    private IdleTransition idleEntry(long seconds) {
        return IdleTransition.entered(clock.millis(), seconds);
    }

    @Test
    void testIdleEntryDispatchesFocusNotification() {
        when(gate.shouldSend(NotificationCategory.IDLE_WARNING, 10)).thenReturn(true);
        when(eventStore.queryRecent(720)).thenReturn(List.of(
            ActivityEvent.create(clock.millis() - 60_000, ActivityCategory.WINDOW_CHANGE,
                new WindowPayload("Excel", "Budget.xlsx", "excel"), "s-1")));
        when(decisionService.decide(any())).thenReturn(
            DecisionVerdict.focus(true, FOCUS_MESSAGE, 0.5, "Fallback heuristic based on idle duration"));
        when(decisionService.currentProviderName()).thenReturn("Fallback");
        when(gate.recordAttempt(eq(NotificationCategory.IDLE_WARNING), eq(FOCUS_MESSAGE), anyMap())).thenReturn("rec-1");

        FocusMonitor monitor = newMonitor(config);
        monitor.start();
        monitor.onTransition(idleEntry(2000));

        ArgumentCaptor<DecisionContext> context = ArgumentCaptor.forClass(DecisionContext.class);
        verify(decisionService).decide(context.capture());
        assertEquals(2000, context.getValue().idleDurationSeconds());
        assertEquals("Excel", context.getValue().mostUsedApp());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(gate).recordAttempt(eq(NotificationCategory.IDLE_WARNING), eq(FOCUS_MESSAGE), metadata.capture());
        assertEquals(2000L, metadata.getValue().get("idle_duration"));
        assertEquals("idle_entry", metadata.getValue().get("trigger_reason"));
        assertEquals("Fallback", metadata.getValue().get("provider"));
        assertEquals(0.5, metadata.getValue().get("confidence"));

        verify(eventStore).log(eq(ActivityCategory.OTHER), any());

        ArgumentCaptor<Notification> notification = ArgumentCaptor.forClass(Notification.class);
        verify(dispatcher).dispatch(notification.capture());
        assertEquals("rec-1", notification.getValue().recordId());
        assertEquals(NotificationCategory.IDLE_WARNING, notification.getValue().category());
        assertEquals(FocusMonitor.FOCUS_TITLE, notification.getValue().title());
        assertEquals(FOCUS_MESSAGE, notification.getValue().message());
    }

    @Test
    void testCooldownSkipsDecision() {
        when(gate.shouldSend(NotificationCategory.IDLE_WARNING, 10)).thenReturn(false);

        FocusMonitor monitor = newMonitor(config);
        monitor.start();
        monitor.onTransition(idleEntry(2000));

        verifyNoInteractions(decisionService, dispatcher);
        verify(gate, never()).recordAttempt(any(), anyString(), anyMap());
    }

    @Test
    void testNegativeVerdictRecordsNothing() {
        when(gate.shouldSend(NotificationCategory.IDLE_WARNING, 10)).thenReturn(true);
        when(eventStore.queryRecent(720)).thenReturn(List.of());
        when(decisionService.decide(any())).thenReturn(DecisionVerdict.focus(false, "Quick break", 0.5, "short"));

        FocusMonitor monitor = newMonitor(config);
        assertTrue(monitor.evaluate(idleEntry(100)).isEmpty());

        verify(gate, never()).recordAttempt(any(), anyString(), anyMap());
        verify(eventStore, never()).log(any(), any());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void testResumeIgnoredByDefaultTrigger() {
        FocusMonitor monitor = newMonitor(config);
        monitor.start();
        monitor.onTransition(IdleTransition.resumed(clock.millis(), 2000, ResumeTrigger.MOUSE));

        verifyNoInteractions(gate, decisionService, dispatcher);
    }

    @Test
    void testResumeEvaluatedWithResumeTrigger() {
        when(gate.shouldSend(NotificationCategory.IDLE_WARNING, 10)).thenReturn(false);

        FocusMonitor monitor = newMonitor(config.withDecisionTrigger(DecisionTrigger.RESUME));
        monitor.start();
        monitor.onTransition(idleEntry(2000));
        monitor.onTransition(IdleTransition.resumed(clock.millis(), 2000, ResumeTrigger.MOUSE));

        verify(gate, times(1)).shouldSend(NotificationCategory.IDLE_WARNING, 10);
    }

    @Test
    void testTransitionsIgnoredWhenNotRunning() {
        FocusMonitor monitor = newMonitor(config);
        monitor.onTransition(idleEntry(2000));

        monitor.start();
        monitor.stop();
        monitor.onTransition(idleEntry(2000));

        verifyNoInteractions(gate, decisionService);
    }

    @Test
    void testUnavailableHistoryFallsBackToIdleOnlyContext() {
        when(gate.shouldSend(NotificationCategory.IDLE_WARNING, 10)).thenReturn(true);
        when(eventStore.queryRecent(720)).thenThrow(new IllegalStateException("disk error"));
        when(decisionService.decide(any())).thenReturn(DecisionVerdict.focus(false, "m", 0.5, "r"));

        newMonitor(config).evaluate(idleEntry(900));

        ArgumentCaptor<DecisionContext> context = ArgumentCaptor.forClass(DecisionContext.class);
        verify(decisionService).decide(context.capture());
        assertEquals(DecisionContext.idleOnly(900), context.getValue());
    }

    @Test
    void testDispatcherFailureDoesNotPropagate() {
        when(gate.shouldSend(NotificationCategory.IDLE_WARNING, 10)).thenReturn(true);
        when(eventStore.queryRecent(720)).thenReturn(List.of());
        when(decisionService.decide(any())).thenReturn(DecisionVerdict.focus(true, FOCUS_MESSAGE, 0.5, "r"));
        when(decisionService.currentProviderName()).thenReturn("Fallback");
        when(gate.recordAttempt(any(), anyString(), anyMap())).thenReturn("rec-2");
        doThrow(new IllegalStateException("tray gone")).when(dispatcher).dispatch(any());

        assertTrue(newMonitor(config).evaluate(idleEntry(2000)).isPresent());
    }

    @Test
    void testWorkCheckSendsGoodJob() {
        List<ActivityEvent> events = new ArrayList<>();
        for (int m = 5; m >= 0; m--) {
            events.add(ActivityEvent.create(clock.millis() - m * 60_000L, ActivityCategory.WINDOW_CHANGE,
                new WindowPayload("Code", "file " + m, "code"), "s-1"));
        }
        when(eventStore.queryRecent(15)).thenReturn(events);
        when(gate.shouldSend(NotificationCategory.GOOD_JOB, 30)).thenReturn(true);
        when(gate.recordAttempt(eq(NotificationCategory.GOOD_JOB), anyString(), anyMap())).thenReturn("rec-3");

        FocusMonitor monitor = newMonitor(config);
        monitor.start();
        assertEquals(Duration.ofMinutes(5), scheduler.period("work-check").orElseThrow());
        scheduler.run("work-check");

        ArgumentCaptor<Notification> notification = ArgumentCaptor.forClass(Notification.class);
        verify(dispatcher).dispatch(notification.capture());
        assertEquals("rec-3", notification.getValue().recordId());
        assertEquals(NotificationCategory.GOOD_JOB, notification.getValue().category());
        assertEquals(FocusMonitor.GOOD_JOB_TITLE, notification.getValue().title());
    }

    @Test
    void testWorkCheckWithoutActivitySendsNothing() {
        when(eventStore.queryRecent(anyInt())).thenReturn(List.of());

        assertTrue(newMonitor(config).checkConsistentWork().isEmpty());

        verifyNoInteractions(gate, dispatcher);
    }

    @Test
    void testWorkCheckFollowsRuntimeThresholdChange() {
        when(eventStore.queryRecent(anyInt())).thenReturn(List.of());
        FocusMonitor monitor = newMonitor(config);

        monitor.checkConsistentWork();
        monitor.updateIdleThreshold(1200);
        monitor.checkConsistentWork();

        verify(eventStore).queryRecent(15);
        verify(eventStore).queryRecent(30);
    }

    @Test
    void testGoodJobMetadataCarriesPatternQuality() {
        List<ActivityEvent> events = new ArrayList<>();
        for (int m = 5; m >= 0; m--) {
            events.add(ActivityEvent.create(clock.millis() - m * 60_000L, ActivityCategory.WINDOW_CHANGE,
                new WindowPayload("Code", "file " + m, "code"), "s-1"));
        }
        when(eventStore.queryRecent(15)).thenReturn(events);
        when(gate.shouldSend(NotificationCategory.GOOD_JOB, 30)).thenReturn(true);
        when(gate.recordAttempt(eq(NotificationCategory.GOOD_JOB), anyString(), anyMap())).thenReturn("rec-4");

        newMonitor(config).checkConsistentWork();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(gate).recordAttempt(eq(NotificationCategory.GOOD_JOB), anyString(), metadata.capture());
        assertEquals(5L, metadata.getValue().get("work_duration"));
        assertEquals("Code", metadata.getValue().get("primary_activity"));
        assertEquals("excellent", metadata.getValue().get("focus_quality"));
        assertEquals(0, metadata.getValue().get("distraction_events"));
    }

    @Test
    void testStopCancelsWorkCheck() {
        FocusMonitor monitor = newMonitor(config);
        monitor.start();
        monitor.stop();
        monitor.stop();

        assertEquals(0, scheduler.activeCount("work-check"));
        assertFalse(monitor.isRunning());
    }

    @Test
    void testReportInteractionForwardsToGate() {
        NotificationInteraction click = NotificationInteraction.ofClick();

        newMonitor(config).reportInteraction("rec-1", click);

        verify(gate).recordInteraction("rec-1", click);
    }
}
