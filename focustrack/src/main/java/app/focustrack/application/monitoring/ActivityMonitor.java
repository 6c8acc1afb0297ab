package app.focustrack.application.monitoring;

import app.focustrack.application.port.output.EventStore;
import app.focustrack.application.port.output.NotificationDispatcher;
import app.focustrack.config.MonitorConfig;
import app.focustrack.config.ProviderType;
import app.focustrack.domain.activity.ActivityEvent;
import app.focustrack.domain.activity.ResumeTrigger;
import app.focustrack.domain.activity.WindowPayload;
import app.focustrack.domain.notification.NotificationInteraction;
import app.focustrack.domain.notification.NotificationStats;
import app.focustrack.infrastructure.persistence.JsonlEventStore;
import app.focustrack.infrastructure.persistence.JsonlNotificationRepository;
import app.focustrack.infrastructure.power.ClockJumpResumeDetector;
import app.focustrack.infrastructure.scheduling.TaskScheduler;
import app.focustrack.service.decision.DecisionProvider;
import app.focustrack.service.decision.DecisionProviderFactory;
import app.focustrack.service.decision.DecisionService;
import app.focustrack.service.decision.FallbackDecisionProvider;
import app.focustrack.service.idle.IdleDetector;
import app.focustrack.service.idle.IdleDetectorStatus;
import app.focustrack.service.notification.NotificationGate;
import app.focustrack.service.pattern.WorkPatternAnalyzer;
import app.focustrack.service.window.WindowTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for the host application: owns the event store, idle detector,
 * notification gate, decision service and decision loop.
 *
 * Usage:
 * <pre>
 * ActivityMonitor monitor = new ActivityMonitor(config, dispatcher, scheduler, Clock.systemUTC());
 * monitor.start();
 * monitor.recordWindow("IntelliJ IDEA", "FocusMonitor.java", "idea");
 * monitor.notifyActivity(ResumeTrigger.KEYBOARD);
 * monitor.reportInteraction(recordId, NotificationInteraction.ofClick());
 * monitor.shutdown();
 * </pre>
 *
 * {@link #start()} and {@link #stop()} may alternate; {@link #shutdown()}
 * releases the store and executors and is final.
 */
public final class ActivityMonitor {
    private static final Logger log = LoggerFactory.getLogger(ActivityMonitor.class);

    private final MonitorConfig config;
    private final EventStore eventStore;
    private final NotificationGate gate;
    private final FallbackDecisionProvider fallback;
    private final DecisionProviderFactory providerFactory;
    private final DecisionService decisionService;
    private final ClockJumpResumeDetector resumeDetector;
    private final IdleDetector idleDetector;
    private final WindowTracker windowTracker;
    private final FocusMonitor focusMonitor;
    private final ExecutorService decisionExecutor;

    private boolean running = false;
    private boolean shutdown = false;

    public ActivityMonitor(MonitorConfig config, NotificationDispatcher dispatcher, TaskScheduler scheduler, Clock clock) {
        this.config = config;
        this.eventStore = new JsonlEventStore(config.storagePath(), config.batchSize(), clock);
        this.gate = new NotificationGate(
            new JsonlNotificationRepository(config.storagePath()), clock, config.maxNotificationsPerHour());

        this.fallback = new FallbackDecisionProvider();
        this.providerFactory = new DecisionProviderFactory(fallback);
        this.decisionService = new DecisionService(
            providerFactory.createWithFallback(config), fallback, config.providerTimeout());

        this.resumeDetector = new ClockJumpResumeDetector(
            scheduler, clock, config.resumeTickInterval(), config.resumeJumpTolerance());
        this.idleDetector = new IdleDetector(eventStore, scheduler, resumeDetector, clock,
            config.idleThresholdSeconds(), config.idlePollInterval());
        this.windowTracker = new WindowTracker(eventStore);

        this.decisionExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "FocusDecision");
            t.setDaemon(true);
            return t;
        });
        this.focusMonitor = new FocusMonitor(eventStore, gate, decisionService, dispatcher,
            new WorkPatternAnalyzer(clock), scheduler, config, decisionExecutor);
        idleDetector.addListener(focusMonitor);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════════

    public synchronized void start() {
        if (shutdown) {
            throw new IllegalStateException("Activity monitor has been shut down");
        }
        if (running) {
            log.warn("[MONITOR] Already running");
            return;
        }
        int removed = gate.cleanup(config.notificationRetentionDays());
        if (removed > 0) {
            log.info("[MONITOR] Removed {} notification records older than {} days",
                removed, config.notificationRetentionDays());
        }

        resumeDetector.start();
        idleDetector.start();
        focusMonitor.start();
        running = true;
        log.info("[MONITOR] Activity monitoring started (session {}, provider {})",
            eventStore.sessionId(), decisionService.currentProviderName());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        focusMonitor.stop();
        idleDetector.stop();
        resumeDetector.stop();
        running = false;
        eventStore.flushAsync();
        log.info("[MONITOR] Activity monitoring stopped");
    }

    /**
     * Stop monitoring, wait briefly for in-flight decisions, flush the event log.
     */
    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        stop();
        shutdown = true;

        decisionExecutor.shutdown();
        try {
            if (!decisionExecutor.awaitTermination(config.providerTimeout().toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                log.warn("[MONITOR] Decision loop did not finish in time");
                decisionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            decisionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        decisionService.shutdown();
        eventStore.shutdown();
        log.info("[MONITOR] Shutdown complete");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // PRODUCER SIGNALS
    // ═══════════════════════════════════════════════════════════════════════════

    public void notifyActivity(ResumeTrigger trigger) {
        idleDetector.notifyActivity(trigger);
    }

    /**
     * @return true if this is a new window and a window_change event was recorded
     */
    public boolean recordWindow(String applicationName, String windowTitle, String processName) {
        return windowTracker.report(new WindowPayload(applicationName, windowTitle, processName));
    }

    public void reportInteraction(String recordId, NotificationInteraction interaction) {
        focusMonitor.reportInteraction(recordId, interaction);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // QUERIES AND SETTINGS
    // ═══════════════════════════════════════════════════════════════════════════

    public MonitorStatus status() {
        IdleDetectorStatus idle = idleDetector.status();
        return new MonitorStatus(
            isRunning(),
            idle.idle(),
            idle.lastActivityTime(),
            idle.thresholdSeconds(),
            decisionService.currentProviderName(),
            eventStore.sessionId(),
            eventStore.bufferedCount());
    }

    public List<ActivityEvent> recentActivity(int minutes) {
        return eventStore.queryRecent(minutes);
    }

    public NotificationStats notificationStats() {
        return gate.stats();
    }

    public void updateIdleThreshold(long thresholdSeconds) {
        idleDetector.updateThreshold(thresholdSeconds);
        focusMonitor.updateIdleThreshold(thresholdSeconds);
    }

    /**
     * Switch the decision provider at runtime.
     *
     * @throws IllegalArgumentException if the provider needs an API key and none is given
     */
    public void setProvider(ProviderType type, String apiKey) {
        DecisionProvider provider = providerFactory.create(type, apiKey, config.providerModel(), config);
        decisionService.setProvider(provider);
    }
}
