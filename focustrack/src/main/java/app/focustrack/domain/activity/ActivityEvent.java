package app.focustrack.domain.activity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable activity event as persisted in the daily JSONL partitions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActivityEvent(
    @JsonProperty("id")
    String id,

    @JsonProperty("timestamp")
    long timestamp,                 // epoch millis, creation time

    @JsonProperty("category")
    ActivityCategory category,

    @JsonProperty("payload")
    JsonNode payload,

    @JsonProperty("session_id")
    String sessionId
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ActivityEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(sessionId, "sessionId");
        payload = payload == null || payload.isNull() ? MAPPER.createObjectNode() : payload;
    }

    /**
     * Create a new event with a fresh id.
     */
    public static ActivityEvent create(long timestamp, ActivityCategory category,
                                       Object payloadPojo, String sessionId) {
        JsonNode payload = payloadPojo instanceof JsonNode
            ? (JsonNode) payloadPojo
            : MAPPER.valueToTree(payloadPojo);
        return new ActivityEvent(UUID.randomUUID().toString(), timestamp, category, payload, sessionId);
    }

    /**
     * Convert the payload to a typed view.
     *
     * @throws IllegalArgumentException if the payload does not match the type
     */
    public <T> T payloadAs(Class<T> type) {
        return MAPPER.convertValue(payload, type);
    }

    @JsonIgnore
    public boolean isWindowChange() {
        return category == ActivityCategory.WINDOW_CHANGE;
    }

    @JsonIgnore
    public boolean isIdle() {
        return category == ActivityCategory.IDLE;
    }
}
