package app.focustrack.domain.notification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * User interaction reported by the display layer. Null flags mean "not reported".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationInteraction(
    @JsonProperty("clicked")
    Boolean clicked,

    @JsonProperty("dismissed")
    Boolean dismissed,

    @JsonProperty("interaction_timestamp")
    Long interactionTimestamp
) {
    public static NotificationInteraction ofClick() {
        return new NotificationInteraction(true, null, null);
    }

    public static NotificationInteraction ofDismiss() {
        return new NotificationInteraction(null, true, null);
    }

    /**
     * Merge an update into this interaction. A flag that is already set is
     * never overwritten.
     *
     * @return merged interaction, or this instance if the update changed nothing
     */
    public NotificationInteraction merge(NotificationInteraction update, long now) {
        Boolean mergedClicked = clicked != null ? clicked : update.clicked();
        Boolean mergedDismissed = dismissed != null ? dismissed : update.dismissed();
        if (Objects.equals(mergedClicked, clicked) && Objects.equals(mergedDismissed, dismissed)) {
            return this;
        }
        return new NotificationInteraction(mergedClicked, mergedDismissed, now);
    }

    public boolean wasClicked() {
        return Boolean.TRUE.equals(clicked);
    }

    public boolean wasDismissed() {
        return Boolean.TRUE.equals(dismissed);
    }
}
