package app.focustrack.application.monitoring;

import app.focustrack.application.port.output.EventStore;
import app.focustrack.application.port.output.NotificationDispatcher;
import app.focustrack.config.MonitorConfig;
import app.focustrack.domain.activity.ActivityCategory;
import app.focustrack.domain.activity.ActivityEvent;
import app.focustrack.domain.decision.DecisionContext;
import app.focustrack.domain.decision.DecisionVerdict;
import app.focustrack.domain.notification.Notification;
import app.focustrack.domain.notification.NotificationCategory;
import app.focustrack.domain.notification.NotificationInteraction;
import app.focustrack.infrastructure.scheduling.ScheduledTask;
import app.focustrack.infrastructure.scheduling.TaskScheduler;
import app.focustrack.service.decision.DecisionService;
import app.focustrack.service.idle.IdleTransition;
import app.focustrack.service.idle.IdleTransitionListener;
import app.focustrack.service.notification.NotificationGate;
import app.focustrack.service.pattern.WorkAnalysis;
import app.focustrack.service.pattern.WorkPattern;
import app.focustrack.service.pattern.WorkPatternAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Decision loop: turns idle transitions into focus notifications.
 *
 * Flow per qualifying transition:
 * <pre>
 * gate cooldown -> recent events -> DecisionContext -> verdict
 *   -> record attempt -> focus_notification event -> dispatch
 * </pre>
 *
 * All gate admissions (focus and good-job) run on the single decision
 * executor, so the check-then-record sequence is never interleaved.
 */
public final class FocusMonitor implements IdleTransitionListener {
    private static final Logger log = LoggerFactory.getLogger(FocusMonitor.class);

    public static final String FOCUS_TITLE = "Time to Focus!";
    public static final String GOOD_JOB_TITLE = "Great Work! 🎉";
    public static final String FOCUS_EVENT_TYPE = "focus_notification";

    // Extra history fetched around the work window
    private static final int WORK_LOOKBACK_PADDING_MINUTES = 10;

    private final EventStore eventStore;
    private final NotificationGate gate;
    private final DecisionService decisionService;
    private final NotificationDispatcher dispatcher;
    private final WorkPatternAnalyzer workAnalyzer;
    private final TaskScheduler scheduler;
    private final MonitorConfig config;
    private final Executor decisionExecutor;

    private volatile boolean running = false;
    private volatile long idleThresholdSeconds;
    private ScheduledTask workCheckTask;

    public FocusMonitor(EventStore eventStore,
                        NotificationGate gate,
                        DecisionService decisionService,
                        NotificationDispatcher dispatcher,
                        WorkPatternAnalyzer workAnalyzer,
                        TaskScheduler scheduler,
                        MonitorConfig config,
                        Executor decisionExecutor) {
        this.eventStore = eventStore;
        this.gate = gate;
        this.decisionService = decisionService;
        this.dispatcher = dispatcher;
        this.workAnalyzer = workAnalyzer;
        this.scheduler = scheduler;
        this.config = config;
        this.decisionExecutor = decisionExecutor;
        this.idleThresholdSeconds = config.idleThresholdSeconds();
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════════

    public synchronized void start() {
        if (running) {
            log.warn("[FOCUS] Already running");
            return;
        }
        Duration interval = config.workCheckInterval();
        workCheckTask = scheduler.scheduleAtFixedRate("work-check",
            () -> submit("work-check", this::checkConsistentWork), interval, interval);
        running = true;
        log.info("[FOCUS] Started: trigger={}, cooldown={}min, work check every {}s",
            config.decisionTrigger(), config.idleWarningCooldownMinutes(), interval.getSeconds());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (workCheckTask != null) {
            workCheckTask.cancel();
            workCheckTask = null;
        }
        log.info("[FOCUS] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // IDLE TRANSITIONS
    // ═══════════════════════════════════════════════════════════════════════════

    @Override
    public void onTransition(IdleTransition transition) {
        if (!running) {
            return;
        }
        boolean qualifies = transition.enteredIdle()
            ? config.decisionTrigger().onIdleEntry()
            : config.decisionTrigger().onResume();
        if (!qualifies) {
            return;
        }
        submit("focus-decision", () -> evaluate(transition));
    }

    /**
     * Run one focus decision for a transition.
     *
     * @return the dispatched notification, empty if gated or the verdict declined
     */
    Optional<Notification> evaluate(IdleTransition transition) {
        if (!gate.shouldSend(NotificationCategory.IDLE_WARNING, config.idleWarningCooldownMinutes())) {
            return Optional.empty();
        }

        DecisionContext context = buildContext(transition.idleDurationSeconds());
        DecisionVerdict verdict = decisionService.decide(context);
        if (!verdict.shouldNotify()) {
            log.info("[FOCUS] No notification after {}s idle: {}", transition.idleDurationSeconds(), verdict.reasoning());
            return Optional.empty();
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("idle_duration", transition.idleDurationSeconds());
        metadata.put("trigger_reason", transition.enteredIdle() ? "idle_entry" : "resume");
        metadata.put("confidence", verdict.confidence());
        metadata.put("reasoning", verdict.reasoning());
        metadata.put("provider", decisionService.currentProviderName());

        String recordId = gate.recordAttempt(NotificationCategory.IDLE_WARNING, verdict.message(), metadata);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", FOCUS_EVENT_TYPE);
        event.put("notification_id", recordId);
        event.put("message", verdict.message());
        event.put("confidence", verdict.confidence());
        event.put("idle_duration", transition.idleDurationSeconds());
        eventStore.log(ActivityCategory.OTHER, event);

        Notification notification = new Notification(
            recordId, NotificationCategory.IDLE_WARNING, FOCUS_TITLE, verdict.message());
        deliver(notification);
        return Optional.of(notification);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // CONSISTENT WORK
    // ═══════════════════════════════════════════════════════════════════════════

    /**
     * Send a good-job notification if the recent history shows sustained work.
     */
    Optional<Notification> checkConsistentWork() {
        int thresholdMinutes = MonitorConfig.workThresholdMinutes(idleThresholdSeconds);
        List<ActivityEvent> events;
        try {
            events = eventStore.queryRecent(thresholdMinutes + WORK_LOOKBACK_PADDING_MINUTES);
        } catch (RuntimeException e) {
            log.error("[FOCUS] Work check could not read activity: {}", e.getMessage());
            return Optional.empty();
        }

        WorkAnalysis analysis = workAnalyzer.hasBeenConsistentlyWorking(
            events, thresholdMinutes, WorkPatternAnalyzer.DEFAULT_MAX_IDLE_GAP_MINUTES);
        if (!analysis.consistent()) {
            return Optional.empty();
        }
        if (!gate.shouldSend(NotificationCategory.GOOD_JOB, config.goodJobCooldownMinutes())) {
            return Optional.empty();
        }

        log.info("[FOCUS] Consistent work detected: {} minutes on {}",
            analysis.workDurationMinutes(), analysis.primaryActivity());

        WorkPattern pattern = workAnalyzer.analyzeWorkPattern(events, thresholdMinutes);
        String message = workAnalyzer.encouragementMessage(pattern, analysis.workDurationMinutes());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("work_duration", analysis.workDurationMinutes());
        metadata.put("primary_activity", analysis.primaryActivity());
        metadata.put("focus_quality", pattern.focusQuality().wireValue());
        metadata.put("distraction_events", pattern.distractionEvents());

        String recordId = gate.recordAttempt(NotificationCategory.GOOD_JOB, message, metadata);
        Notification notification = new Notification(recordId, NotificationCategory.GOOD_JOB, GOOD_JOB_TITLE, message);
        deliver(notification);
        return Optional.of(notification);
    }

    /**
     * Follow a runtime idle threshold change; the work window is the threshold in minutes.
     */
    public void updateIdleThreshold(long thresholdSeconds) {
        this.idleThresholdSeconds = thresholdSeconds;
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // INTERACTIONS
    // ═══════════════════════════════════════════════════════════════════════════

    public void reportInteraction(String recordId, NotificationInteraction interaction) {
        gate.recordInteraction(recordId, interaction);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════════

    private DecisionContext buildContext(long idleDurationSeconds) {
        try {
            return DecisionContext.fromEvents(idleDurationSeconds, eventStore.queryRecent(config.contextWindowMinutes()));
        } catch (RuntimeException e) {
            log.warn("[FOCUS] Activity history unavailable, deciding on idle duration only: {}", e.getMessage());
            return DecisionContext.idleOnly(idleDurationSeconds);
        }
    }

    private void deliver(Notification notification) {
        try {
            dispatcher.dispatch(notification);
        } catch (RuntimeException e) {
            log.error("[FOCUS] Dispatch of {} failed: {}", notification.recordId(), e.getMessage(), e);
        }
    }

    private void submit(String name, Runnable work) {
        try {
            decisionExecutor.execute(() -> {
                try {
                    work.run();
                } catch (Exception e) {
                    log.error("[FOCUS] {} failed: {}", name, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("[FOCUS] {} rejected, decision executor is shut down", name);
        }
    }
}
