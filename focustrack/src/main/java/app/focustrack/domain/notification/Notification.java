package app.focustrack.domain.notification;

/**
 * Notification handed to the display layer. The record id correlates the
 * later click/dismiss report.
 */
public record Notification(
    String recordId,
    NotificationCategory category,
    String title,
    String message
) {
}
