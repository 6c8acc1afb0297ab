package app.focustrack.bootstrap;

import app.focustrack.application.port.output.NotificationDispatcher;
import app.focustrack.domain.notification.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Dispatcher for headless runs: logs the notification and prints one line
 * per notification so a host process can render it.
 *
 * Output format: {@code NOTIFY <record id> <category> <title> | <message>}
 */
public final class LoggingNotificationDispatcher implements NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

    private final PrintStream out;

    public LoggingNotificationDispatcher(PrintStream out) {
        this.out = out;
    }

    @Override
    public void dispatch(Notification notification) {
        switch (notification.category()) {
            case IDLE_WARNING:
            case FOCUS_REMINDER:
                log.warn("[NOTIFY-FOCUS] {} - {}", notification.title(), notification.message());
                break;
            case GOOD_JOB:
            case DAILY_PLAN:
                log.info("[NOTIFY-INFO] {} - {}", notification.title(), notification.message());
                break;
        }

        out.println("NOTIFY " + notification.recordId() + " " + notification.category().wireValue()
            + " " + notification.title() + " | " + notification.message());
        out.flush();
    }
}
