package app.focustrack.config;

import app.focustrack.util.Env;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Monitoring configuration supplied by the host's settings layer.
 */
public record MonitorConfig(
    long idleThresholdSeconds,          // user counts as idle after this much inactivity
    Duration idlePollInterval,          // periodic idle check
    int batchSize,                      // events buffered before an automatic flush
    Path storagePath,                   // activity partitions and notifications.jsonl
    int idleWarningCooldownMinutes,
    int goodJobCooldownMinutes,
    int maxNotificationsPerHour,        // across all categories, 0 disables
    int notificationRetentionDays,
    ProviderType providerType,
    String providerApiKey,
    String providerModel,
    Duration providerTimeout,
    DecisionTrigger decisionTrigger,
    int contextWindowMinutes,           // event history handed to the provider
    Duration workCheckInterval,         // consistent-work (good job) check
    Duration resumeTickInterval,
    Duration resumeJumpTolerance
) {
    public static final long DEFAULT_IDLE_THRESHOLD_SECONDS = 300;
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final String DEFAULT_MODEL = "gemini-1.5-flash";

    public static MonitorConfig defaults(Path storagePath) {
        return new MonitorConfig(
            DEFAULT_IDLE_THRESHOLD_SECONDS,
            Duration.ofSeconds(30),
            DEFAULT_BATCH_SIZE,
            storagePath,
            10,
            30,
            10,
            30,
            ProviderType.FALLBACK,
            null,
            DEFAULT_MODEL,
            Duration.ofSeconds(10),
            DecisionTrigger.IDLE_ENTRY,
            12 * 60,
            Duration.ofMinutes(5),
            Duration.ofSeconds(5),
            Duration.ofSeconds(30)
        );
    }

    /**
     * Load from FOCUS_* environment variables (or system properties).
     */
    public static MonitorConfig fromEnv() {
        Path defaultStorage = Path.of(System.getProperty("user.home"), ".focustrack");
        MonitorConfig d = defaults(defaultStorage);
        return new MonitorConfig(
            Env.getLong("FOCUS_IDLE_THRESHOLD_SECONDS", d.idleThresholdSeconds()),
            Env.getSeconds("FOCUS_IDLE_POLL_SECONDS", d.idlePollInterval()),
            Env.getInt("FOCUS_LOG_BATCH_SIZE", d.batchSize()),
            Path.of(Env.get("FOCUS_STORAGE_PATH", defaultStorage.toString())),
            Env.getInt("FOCUS_IDLE_WARNING_COOLDOWN_MINUTES", d.idleWarningCooldownMinutes()),
            Env.getInt("FOCUS_GOOD_JOB_COOLDOWN_MINUTES", d.goodJobCooldownMinutes()),
            Env.getInt("FOCUS_MAX_NOTIFICATIONS_PER_HOUR", d.maxNotificationsPerHour()),
            Env.getInt("FOCUS_NOTIFICATION_RETENTION_DAYS", d.notificationRetentionDays()),
            ProviderType.parse(Env.get("FOCUS_PROVIDER", "fallback")),
            Env.get("FOCUS_PROVIDER_API_KEY", null),
            Env.get("FOCUS_PROVIDER_MODEL", d.providerModel()),
            Env.getSeconds("FOCUS_PROVIDER_TIMEOUT_SECONDS", d.providerTimeout()),
            DecisionTrigger.parse(Env.get("FOCUS_DECISION_TRIGGER", null), d.decisionTrigger()),
            Env.getInt("FOCUS_CONTEXT_WINDOW_MINUTES", d.contextWindowMinutes()),
            Env.getSeconds("FOCUS_WORK_CHECK_SECONDS", d.workCheckInterval()),
            d.resumeTickInterval(),
            d.resumeJumpTolerance()
        );
    }

    public MonitorConfig withIdleThresholdSeconds(long seconds) {
        return new MonitorConfig(seconds, idlePollInterval, batchSize, storagePath,
            idleWarningCooldownMinutes, goodJobCooldownMinutes, maxNotificationsPerHour,
            notificationRetentionDays, providerType, providerApiKey, providerModel, providerTimeout,
            decisionTrigger, contextWindowMinutes, workCheckInterval, resumeTickInterval, resumeJumpTolerance);
    }

    public MonitorConfig withProvider(ProviderType type, String apiKey) {
        return new MonitorConfig(idleThresholdSeconds, idlePollInterval, batchSize, storagePath,
            idleWarningCooldownMinutes, goodJobCooldownMinutes, maxNotificationsPerHour,
            notificationRetentionDays, type, apiKey, providerModel, providerTimeout,
            decisionTrigger, contextWindowMinutes, workCheckInterval, resumeTickInterval, resumeJumpTolerance);
    }

    public MonitorConfig withDecisionTrigger(DecisionTrigger trigger) {
        return new MonitorConfig(idleThresholdSeconds, idlePollInterval, batchSize, storagePath,
            idleWarningCooldownMinutes, goodJobCooldownMinutes, maxNotificationsPerHour,
            notificationRetentionDays, providerType, providerApiKey, providerModel, providerTimeout,
            trigger, contextWindowMinutes, workCheckInterval, resumeTickInterval, resumeJumpTolerance);
    }

    /**
     * Idle threshold expressed in whole minutes, the window of the consistent-work check.
     */
    public int workThresholdMinutes() {
        return workThresholdMinutes(idleThresholdSeconds);
    }

    public static int workThresholdMinutes(long idleThresholdSeconds) {
        return (int) Math.max(1, idleThresholdSeconds / 60);
    }
}
