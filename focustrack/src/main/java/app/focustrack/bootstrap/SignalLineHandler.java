package app.focustrack.bootstrap;

import app.focustrack.application.monitoring.ActivityMonitor;
import app.focustrack.application.monitoring.MonitorStatus;
import app.focustrack.domain.activity.ResumeTrigger;
import app.focustrack.domain.notification.NotificationInteraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Line protocol for driving the monitor from a host process.
 *
 * Commands:
 * <pre>
 * activity [mouse|keyboard]      input observed
 * window &lt;app&gt;|&lt;title&gt;[|&lt;process&gt;] focused window
 * click &lt;record id&gt;             notification clicked
 * dismiss &lt;record id&gt;           notification dismissed
 * threshold &lt;seconds&gt;           change idle threshold
 * status                         print a status line
 * quit                           stop reading
 * </pre>
 */
public final class SignalLineHandler {
    private static final Logger log = LoggerFactory.getLogger(SignalLineHandler.class);

    private final ActivityMonitor monitor;
    private final PrintStream out;

    public SignalLineHandler(ActivityMonitor monitor, PrintStream out) {
        this.monitor = monitor;
        this.out = out;
    }

    /**
     * Handle one input line.
     *
     * @return false when the host asked to quit
     */
    public boolean handle(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }

        int space = trimmed.indexOf(' ');
        String command = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        String argument = space < 0 ? "" : trimmed.substring(space + 1).trim();

        switch (command) {
            case "activity":
                monitor.notifyActivity(argument.isEmpty() ? ResumeTrigger.UNKNOWN : ResumeTrigger.fromWire(argument));
                return true;
            case "window":
                handleWindow(argument);
                return true;
            case "click":
                handleInteraction(argument, NotificationInteraction.ofClick());
                return true;
            case "dismiss":
                handleInteraction(argument, NotificationInteraction.ofDismiss());
                return true;
            case "threshold":
                handleThreshold(argument);
                return true;
            case "status":
                printStatus();
                return true;
            case "quit":
            case "exit":
                return false;
            default:
                log.warn("[SIGNAL] Unknown command: {}", command);
                out.println("ERROR unknown command: " + command);
                return true;
        }
    }

    private void handleWindow(String argument) {
        String[] parts = argument.split("\\|", -1);
        if (argument.isEmpty()) {
            out.println("ERROR usage: window <app>|<title>[|<process>]");
            return;
        }
        String app = parts[0].trim();
        String title = parts.length > 1 ? parts[1].trim() : "";
        String process = parts.length > 2 ? parts[2].trim() : "";
        monitor.recordWindow(app, title, process);
    }

    private void handleInteraction(String recordId, NotificationInteraction interaction) {
        if (recordId.isEmpty()) {
            out.println("ERROR missing notification id");
            return;
        }
        monitor.reportInteraction(recordId, interaction);
    }

    private void handleThreshold(String argument) {
        try {
            monitor.updateIdleThreshold(Long.parseLong(argument));
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            out.println("ERROR invalid threshold: " + argument);
        }
    }

    private void printStatus() {
        MonitorStatus status = monitor.status();
        out.println("STATUS running=" + status.running()
            + " idle=" + status.idle()
            + " last_activity=" + status.lastActivityTime()
            + " threshold=" + status.idleThresholdSeconds()
            + " provider=" + status.provider()
            + " buffered=" + status.bufferedEvents());
    }
}
