package app.focustrack.bootstrap;

import app.focustrack.config.MonitorConfig;
import app.focustrack.config.ProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Startup configuration validator.
 *
 * Called from {@link App#main} before anything is wired. Throws
 * IllegalStateException if the configuration is unusable, so the monitor
 * refuses to start instead of misbehaving later.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException if the configuration is invalid
     */
    public static void validate(MonitorConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");

        if (config.idleThresholdSeconds() <= 0) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: FOCUS_IDLE_THRESHOLD_SECONDS must be positive, got " + config.idleThresholdSeconds());
        }
        if (config.batchSize() <= 0) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: FOCUS_LOG_BATCH_SIZE must be positive, got " + config.batchSize());
        }
        if (config.idlePollInterval().isZero() || config.idlePollInterval().isNegative()) {
            throw new IllegalStateException("❌ INVALID CONFIG: FOCUS_IDLE_POLL_SECONDS must be positive");
        }
        if (config.workCheckInterval().isZero() || config.workCheckInterval().isNegative()) {
            throw new IllegalStateException("❌ INVALID CONFIG: FOCUS_WORK_CHECK_SECONDS must be positive");
        }
        if (config.providerTimeout().isZero() || config.providerTimeout().isNegative()) {
            throw new IllegalStateException("❌ INVALID CONFIG: FOCUS_PROVIDER_TIMEOUT_SECONDS must be positive");
        }
        if (config.idleWarningCooldownMinutes() < 0 || config.goodJobCooldownMinutes() < 0) {
            throw new IllegalStateException("❌ INVALID CONFIG: notification cooldowns must not be negative");
        }
        if (config.maxNotificationsPerHour() < 0) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: FOCUS_MAX_NOTIFICATIONS_PER_HOUR must be 0 (disabled) or positive");
        }
        if (config.contextWindowMinutes() <= 0) {
            throw new IllegalStateException("❌ INVALID CONFIG: FOCUS_CONTEXT_WINDOW_MINUTES must be positive");
        }

        Path storage = config.storagePath();
        if (storage == null) {
            throw new IllegalStateException("❌ INVALID CONFIG: FOCUS_STORAGE_PATH is not set");
        }
        if (Files.exists(storage) && !Files.isDirectory(storage)) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: FOCUS_STORAGE_PATH is not a directory: " + storage);
        }
        log.info("✓ Storage directory: {}", storage.toAbsolutePath());

        if (config.providerType() != ProviderType.FALLBACK) {
            if (config.providerApiKey() == null || config.providerApiKey().isBlank()) {
                log.warn("⚠️  Provider {} selected without FOCUS_PROVIDER_API_KEY, using fallback heuristics",
                    config.providerType());
            } else {
                log.info("✓ Provider {} with model {}", config.providerType(), config.providerModel());
            }
        } else {
            log.info("✓ Provider: fallback heuristics");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }
}
