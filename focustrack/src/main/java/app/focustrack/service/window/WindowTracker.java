package app.focustrack.service.window;

import app.focustrack.application.port.output.EventStore;
import app.focustrack.domain.activity.ActivityCategory;
import app.focustrack.domain.activity.WindowPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Front end for window-signal producers. Producers may report the focused
 * window on every poll; only actual changes become {@code window_change} events.
 */
public final class WindowTracker {
    private static final Logger log = LoggerFactory.getLogger(WindowTracker.class);

    private final EventStore eventStore;
    private WindowPayload currentWindow;

    public WindowTracker(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    /**
     * Report the currently focused window.
     *
     * @return true if it differs from the previous report and was recorded
     */
    public synchronized boolean report(WindowPayload window) {
        if (window == null || window.equals(currentWindow)) {
            return false;
        }
        currentWindow = window;
        eventStore.log(ActivityCategory.WINDOW_CHANGE, window);
        log.debug("[WINDOW] Focus moved to {}", window.describe());
        return true;
    }

    public synchronized WindowPayload currentWindow() {
        return currentWindow;
    }
}
