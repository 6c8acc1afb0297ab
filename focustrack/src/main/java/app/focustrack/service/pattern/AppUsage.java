package app.focustrack.service.pattern;

/**
 * Time attributed to one application, from one window change to the next.
 */
public record AppUsage(String application, double durationMinutes, double percentage) {}
