package app.focustrack.domain.notification;

import java.util.Map;

/**
 * Aggregate notification statistics.
 */
public record NotificationStats(
    int totalSent,
    Map<NotificationCategory, Integer> byCategory,
    int last24h,
    int lastWeek,
    double avgPerDay,
    int clicked,
    int dismissed,
    double clickRate,       // clicked / totalSent
    double dismissRate      // dismissed / totalSent
) {
}
