package app.focustrack.service.idle;

import app.focustrack.domain.activity.IdlePayload;
import app.focustrack.domain.activity.ResumeTrigger;

/**
 * A change between the active and idle states.
 *
 * @param enteredIdle         true for active to idle, false for idle to active
 * @param timestampMillis     when the transition was observed
 * @param idleDurationSeconds time since the last recorded activity
 * @param trigger             input that ended the idle period ({@code UNKNOWN} on idle entry)
 */
public record IdleTransition(
    boolean enteredIdle,
    long timestampMillis,
    long idleDurationSeconds,
    ResumeTrigger trigger
) {
    public static IdleTransition entered(long timestampMillis, long idleDurationSeconds) {
        return new IdleTransition(true, timestampMillis, idleDurationSeconds, ResumeTrigger.UNKNOWN);
    }

    public static IdleTransition resumed(long timestampMillis, long idleDurationSeconds, ResumeTrigger trigger) {
        return new IdleTransition(false, timestampMillis, idleDurationSeconds, trigger);
    }

    public IdlePayload toPayload() {
        return enteredIdle
            ? IdlePayload.entered(idleDurationSeconds)
            : IdlePayload.resumed(idleDurationSeconds, trigger);
    }
}
