package app.focustrack.bootstrap;

import app.focustrack.application.monitoring.ActivityMonitor;
import app.focustrack.config.MonitorConfig;
import app.focustrack.infrastructure.scheduling.ExecutorTaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Headless entry point.
 *
 * Reads configuration from FOCUS_* variables, starts monitoring and then
 * takes producer signals as line commands on stdin (see {@link SignalLineHandler}).
 * Notifications are written to stdout as {@code NOTIFY} lines.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("  FocusTrack activity monitor");
        log.info("═══════════════════════════════════════════════════════════════");

        MonitorConfig config = MonitorConfig.fromEnv();
        StartupConfigValidator.validate(config);

        ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("FocusScheduler", 2);
        ActivityMonitor monitor = new ActivityMonitor(
            config, new LoggingNotificationDispatcher(System.out), scheduler, Clock.systemUTC());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            monitor.shutdown();
            scheduler.shutdown();
        }, "FocusShutdown"));

        monitor.start();

        SignalLineHandler handler = new SignalLineHandler(monitor, System.out);
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                try {
                    if (!handler.handle(line)) {
                        break;
                    }
                } catch (RuntimeException e) {
                    log.error("[SIGNAL] Failed to handle '{}': {}", line, e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            log.error("Failed to read signals from stdin: {}", e.getMessage(), e);
        }

        log.info("Input closed, stopping monitor");
        monitor.shutdown();
        scheduler.shutdown();
    }
}
