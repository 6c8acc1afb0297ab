package app.focustrack.infrastructure.power;

import app.focustrack.infrastructure.scheduling.ScheduledTask;
import app.focustrack.infrastructure.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Detects suspend/resume without native hooks: a timer ticks every
 * {@code tickInterval}; if the wall clock advanced more than
 * {@code tickInterval + tolerance} between two ticks, the machine was asleep.
 */
public final class ClockJumpResumeDetector implements ResumeSignalSource {
    private static final Logger log = LoggerFactory.getLogger(ClockJumpResumeDetector.class);

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration tickInterval;
    private final Duration tolerance;
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private ScheduledTask tickTask;
    private volatile long lastTickMillis;

    public ClockJumpResumeDetector(TaskScheduler scheduler, Clock clock, Duration tickInterval, Duration tolerance) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.tickInterval = tickInterval;
        this.tolerance = tolerance;
    }

    public synchronized void start() {
        if (tickTask != null) {
            return;
        }
        lastTickMillis = clock.millis();
        tickTask = scheduler.scheduleAtFixedRate("resume-detector", this::tick, tickInterval, tickInterval);
        log.info("[RESUME] Watching for clock jumps (tick={}s, tolerance={}s)",
            tickInterval.getSeconds(), tolerance.getSeconds());
    }

    public synchronized void stop() {
        if (tickTask == null) {
            return;
        }
        tickTask.cancel();
        tickTask = null;
    }

    @Override
    public Registration onResume(Runnable callback) {
        callbacks.add(callback);
        return () -> callbacks.remove(callback);
    }

    void tick() {
        long now = clock.millis();
        long elapsed = now - lastTickMillis;
        lastTickMillis = now;

        if (elapsed <= tickInterval.toMillis() + tolerance.toMillis()) {
            return;
        }

        log.info("[RESUME] Clock jumped {}s between ticks, treating as resume from suspend", elapsed / 1000);
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (Exception e) {
                log.error("[RESUME] Resume callback threw exception", e);
            }
        }
    }
}
