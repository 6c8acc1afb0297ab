package app.focustrack.domain.activity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of a {@link ActivityCategory#WINDOW_CHANGE} event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WindowPayload(
    @JsonProperty("application_name")
    String applicationName,

    @JsonProperty("window_title")
    String windowTitle,

    @JsonProperty("process_name")
    String processName
) {
    public WindowPayload {
        applicationName = applicationName == null || applicationName.isBlank() ? "Unknown" : applicationName;
        windowTitle = windowTitle == null || windowTitle.isBlank() ? "No Window" : windowTitle;
        processName = processName == null || processName.isBlank() ? "unknown" : processName;
    }

    /**
     * "App: Title" form used in prompts and notification context.
     */
    public String describe() {
        return applicationName + ": " + windowTitle;
    }
}
