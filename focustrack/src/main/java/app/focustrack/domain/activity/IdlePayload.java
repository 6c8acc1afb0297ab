package app.focustrack.domain.activity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of an {@link ActivityCategory#IDLE} event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdlePayload(
    @JsonProperty("idle_duration")
    long idleDuration,              // seconds

    @JsonProperty("was_idle")
    boolean wasIdle,                // true on idle entry, false on resume

    @JsonProperty("resume_trigger")
    ResumeTrigger resumeTrigger
) {
    public static IdlePayload entered(long idleDurationSeconds) {
        return new IdlePayload(idleDurationSeconds, true, ResumeTrigger.UNKNOWN);
    }

    public static IdlePayload resumed(long idleDurationSeconds, ResumeTrigger trigger) {
        return new IdlePayload(idleDurationSeconds, false, trigger);
    }
}
