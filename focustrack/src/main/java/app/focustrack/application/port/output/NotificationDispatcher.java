package app.focustrack.application.port.output;

import app.focustrack.domain.notification.Notification;

/**
 * Display layer that renders notifications to the user.
 *
 * Click and dismiss reports come back through
 * {@code ActivityMonitor.reportInteraction} with the notification's record id.
 */
public interface NotificationDispatcher {

    void dispatch(Notification notification);
}
