package app.focustrack.service.idle;

import app.focustrack.domain.activity.ResumeTrigger;

import java.util.Optional;

/**
 * Active/idle state machine. Time is passed in, so the transition rules are
 * independent of any timer or clock.
 *
 * Not thread-safe; the owning {@link IdleDetector} serializes access.
 */
public final class IdleStateMachine {

    private long lastActivityMillis;
    private boolean idle;
    private long thresholdSeconds;

    /**
     * Starts {@code Active} with the idle clock at {@code nowMillis}.
     */
    public IdleStateMachine(long nowMillis, long thresholdSeconds) {
        setThresholdSeconds(thresholdSeconds);
        this.lastActivityMillis = nowMillis;
        this.idle = false;
    }

    /**
     * Periodic check: enter idle once the threshold has elapsed.
     */
    public Optional<IdleTransition> check(long nowMillis) {
        if (idle) {
            return Optional.empty();
        }
        long elapsedMillis = nowMillis - lastActivityMillis;
        if (elapsedMillis < thresholdSeconds * 1000L) {
            return Optional.empty();
        }
        idle = true;
        return Optional.of(IdleTransition.entered(nowMillis, elapsedMillis / 1000L));
    }

    /**
     * Fresh activity: reset the idle clock and leave idle if needed.
     */
    public Optional<IdleTransition> activity(long nowMillis, ResumeTrigger trigger) {
        long elapsedSeconds = Math.max(0, nowMillis - lastActivityMillis) / 1000L;
        lastActivityMillis = Math.max(lastActivityMillis, nowMillis);
        if (!idle) {
            return Optional.empty();
        }
        idle = false;
        return Optional.of(IdleTransition.resumed(nowMillis, elapsedSeconds, trigger == null ? ResumeTrigger.UNKNOWN : trigger));
    }

    public boolean isIdle() {
        return idle;
    }

    public long lastActivityMillis() {
        return lastActivityMillis;
    }

    public long thresholdSeconds() {
        return thresholdSeconds;
    }

    public void setThresholdSeconds(long thresholdSeconds) {
        if (thresholdSeconds <= 0) {
            throw new IllegalArgumentException("Idle threshold must be positive: " + thresholdSeconds);
        }
        this.thresholdSeconds = thresholdSeconds;
    }
}
