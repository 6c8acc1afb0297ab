package app.focustrack.service.idle;

import app.focustrack.application.port.output.EventStore;
import app.focustrack.domain.activity.ActivityCategory;
import app.focustrack.domain.activity.ResumeTrigger;
import app.focustrack.infrastructure.power.ResumeSignalSource;
import app.focustrack.infrastructure.scheduling.ScheduledTask;
import app.focustrack.infrastructure.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks active/idle transitions and records them as {@code idle} events.
 *
 * Features:
 * - Periodic idle check on a fixed interval
 * - Immediate check plus resume transition on OS resume-from-suspend
 * - Producers report input through {@link #notifyActivity(ResumeTrigger)}
 * - No duplicate entry events while idle, none while active
 *
 * Usage:
 * <pre>
 * IdleDetector detector = new IdleDetector(store, scheduler, resumeSource,
 *     Clock.systemUTC(), 300, Duration.ofSeconds(30));
 * detector.addListener(t -> decisionLoop.submit(t));
 * detector.start();
 * detector.notifyActivity(ResumeTrigger.KEYBOARD);
 * detector.stop();
 * </pre>
 */
public final class IdleDetector {
    private static final Logger log = LoggerFactory.getLogger(IdleDetector.class);

    private final EventStore eventStore;
    private final TaskScheduler scheduler;
    private final ResumeSignalSource resumeSource;
    private final Clock clock;
    private final Duration pollInterval;
    private final IdleStateMachine state;
    private final List<IdleTransitionListener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledTask checkTask;
    private ResumeSignalSource.Registration resumeRegistration;
    private boolean running = false;

    /**
     * @param resumeSource OS resume signals, or null when the host has none
     */
    public IdleDetector(EventStore eventStore, TaskScheduler scheduler, ResumeSignalSource resumeSource,
                        Clock clock, long thresholdSeconds, Duration pollInterval) {
        this.eventStore = eventStore;
        this.scheduler = scheduler;
        this.resumeSource = resumeSource;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.state = new IdleStateMachine(clock.millis(), thresholdSeconds);
    }

    public void addListener(IdleTransitionListener listener) {
        listeners.add(listener);
    }

    public synchronized void start() {
        if (running) {
            log.warn("[IDLE] Idle detector already running");
            return;
        }
        log.info("[IDLE] Starting idle detection (threshold: {}s, poll: {}s)",
            state.thresholdSeconds(), pollInterval.getSeconds());

        running = true;
        checkTask = scheduler.scheduleAtFixedRate("idle-check", this::checkNow, pollInterval, pollInterval);
        if (resumeSource != null) {
            resumeRegistration = resumeSource.onResume(this::handleResume);
        }
    }

    /**
     * Cancel the periodic check and detach from resume signals. Safe to call
     * repeatedly and before {@link #start()}.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("[IDLE] Stopping idle detection");
        running = false;

        if (checkTask != null) {
            checkTask.cancel();
            checkTask = null;
        }
        if (resumeRegistration != null) {
            resumeRegistration.remove();
            resumeRegistration = null;
        }
    }

    /**
     * Report user input. Resets the idle clock; ends an idle period if one is active.
     */
    public void notifyActivity(ResumeTrigger trigger) {
        Optional<IdleTransition> transition;
        synchronized (this) {
            transition = state.activity(clock.millis(), trigger);
            transition.ifPresent(this::record);
        }
        transition.ifPresent(this::publish);
    }

    /**
     * Run the threshold check immediately.
     */
    void checkNow() {
        Optional<IdleTransition> transition;
        synchronized (this) {
            if (!running) {
                return;
            }
            transition = state.check(clock.millis());
            transition.ifPresent(this::record);
        }
        transition.ifPresent(this::publish);
    }

    /**
     * OS resume: the timer did not run while suspended, so check first, then resume.
     */
    void handleResume() {
        List<IdleTransition> transitions = new ArrayList<>(2);
        synchronized (this) {
            if (!running) {
                return;
            }
            long now = clock.millis();
            state.check(now).ifPresent(transitions::add);
            state.activity(now, ResumeTrigger.UNKNOWN).ifPresent(transitions::add);
            transitions.forEach(this::record);
        }
        log.info("[IDLE] System resumed from sleep");
        transitions.forEach(this::publish);
    }

    public synchronized IdleDetectorStatus status() {
        return new IdleDetectorStatus(running, state.isIdle(), state.lastActivityMillis(), state.thresholdSeconds());
    }

    public synchronized void updateThreshold(long thresholdSeconds) {
        log.info("[IDLE] Updating idle threshold from {}s to {}s", state.thresholdSeconds(), thresholdSeconds);
        state.setThresholdSeconds(thresholdSeconds);
    }

    private void record(IdleTransition transition) {
        if (transition.enteredIdle()) {
            log.info("[IDLE] User became idle after {}s", transition.idleDurationSeconds());
        } else {
            log.info("[IDLE] User resumed activity after {}s ({})",
                transition.idleDurationSeconds(), transition.trigger().wireValue());
        }
        eventStore.log(ActivityCategory.IDLE, transition.toPayload());
    }

    private void publish(IdleTransition transition) {
        for (IdleTransitionListener listener : listeners) {
            try {
                listener.onTransition(transition);
            } catch (Exception e) {
                log.error("[IDLE] Transition listener threw exception", e);
            }
        }
    }
}
