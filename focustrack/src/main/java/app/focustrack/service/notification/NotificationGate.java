package app.focustrack.service.notification;

import app.focustrack.application.port.output.NotificationRepository;
import app.focustrack.domain.notification.NotificationCategory;
import app.focustrack.domain.notification.NotificationInteraction;
import app.focustrack.domain.notification.NotificationRecord;
import app.focustrack.domain.notification.NotificationStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Cooldown-based admission for notifications, plus outcome tracking.
 *
 * Intended use from a single decision loop:
 * <pre>
 * if (gate.shouldSend(NotificationCategory.IDLE_WARNING, 10)) {
 *     String id = gate.recordAttempt(NotificationCategory.IDLE_WARNING, message, metadata);
 *     dispatcher.dispatch(...);
 * }
 * // later, from the display layer:
 * gate.recordInteraction(id, NotificationInteraction.ofClick());
 * </pre>
 *
 * The check and the record are separate calls. Two concurrent callers could
 * both pass {@link #shouldSend} for one category before either records.
 */
public final class NotificationGate {
    private static final Logger log = LoggerFactory.getLogger(NotificationGate.class);

    private static final long HOUR_MS = TimeUnit.HOURS.toMillis(1);
    private static final long DAY_MS = TimeUnit.DAYS.toMillis(1);

    private final NotificationRepository repository;
    private final Clock clock;
    private final int maxPerHour;
    private final List<NotificationRecord> records = new ArrayList<>();

    /**
     * @param maxPerHour cap across all categories within one hour; 0 disables it
     */
    public NotificationGate(NotificationRepository repository, Clock clock, int maxPerHour) {
        this.repository = repository;
        this.clock = clock;
        this.maxPerHour = maxPerHour;
        load();
    }

    private void load() {
        try {
            records.addAll(repository.loadAll());
            log.info("[GATE] Loaded {} notification records", records.size());
        } catch (IOException e) {
            log.error("[GATE] Failed to load notification records, starting empty: {}", e.getMessage());
        }
    }

    /**
     * Whether a notification of {@code category} may be sent now.
     *
     * @return false if a record of the category is younger than the cooldown,
     *         or the hourly cap is reached
     */
    public synchronized boolean shouldSend(NotificationCategory category, int cooldownMinutes) {
        long now = clock.millis();
        long cutoff = now - TimeUnit.MINUTES.toMillis(cooldownMinutes);

        long recent = records.stream()
            .filter(r -> r.category() == category && r.timestamp() >= cutoff)
            .count();
        if (recent > 0) {
            log.debug("[GATE] Skipping {} - {} sent in last {} minutes", category.wireValue(), recent, cooldownMinutes);
            return false;
        }

        if (maxPerHour > 0) {
            long lastHour = records.stream().filter(r -> r.timestamp() > now - HOUR_MS).count();
            if (lastHour >= maxPerHour) {
                log.info("[GATE] Skipping {} - {} notifications already sent in the last hour",
                    category.wireValue(), lastHour);
                return false;
            }
        }
        return true;
    }

    /**
     * Record an admitted notification.
     *
     * @return record id for correlating the later interaction report
     */
    public synchronized String recordAttempt(NotificationCategory category, String message, Map<String, Object> metadata) {
        NotificationRecord record = new NotificationRecord(
            UUID.randomUUID().toString(), category, message, clock.millis(), metadata, null);
        records.add(record);
        persist();
        log.info("[GATE] Recorded {} notification {}: {}", category.wireValue(), record.id(), message);
        return record.id();
    }

    /**
     * Merge a click/dismiss report into a record. Unknown ids are ignored.
     */
    public synchronized void recordInteraction(String recordId, NotificationInteraction interaction) {
        for (int i = 0; i < records.size(); i++) {
            NotificationRecord current = records.get(i);
            if (!current.id().equals(recordId)) {
                continue;
            }
            NotificationRecord updated = current.withInteraction(interaction, clock.millis());
            if (updated != current) {
                records.set(i, updated);
                persist();
                log.info("[GATE] Interaction on {}: clicked={}, dismissed={}",
                    recordId, updated.wasClicked(), updated.wasDismissed());
            }
            return;
        }
        log.debug("[GATE] Interaction for unknown notification {} ignored", recordId);
    }

    public synchronized Optional<NotificationRecord> find(String recordId) {
        return records.stream().filter(r -> r.id().equals(recordId)).findFirst();
    }

    public synchronized NotificationStats stats() {
        long now = clock.millis();
        Map<NotificationCategory, Integer> byCategory = new EnumMap<>(NotificationCategory.class);
        int last24h = 0;
        int lastWeek = 0;
        int clicked = 0;
        int dismissed = 0;
        long first = Long.MAX_VALUE;

        for (NotificationRecord r : records) {
            byCategory.merge(r.category(), 1, Integer::sum);
            long age = now - r.timestamp();
            if (age < DAY_MS) last24h++;
            if (age < 7 * DAY_MS) lastWeek++;
            if (r.wasClicked()) clicked++;
            if (r.wasDismissed()) dismissed++;
            first = Math.min(first, r.timestamp());
        }

        int total = records.size();
        double avgPerDay = 0.0;
        if (total > 0) {
            double days = Math.max(1.0, (now - first) / (double) DAY_MS);
            avgPerDay = Math.round(total / days * 100.0) / 100.0;
        }

        return new NotificationStats(
            total,
            byCategory,
            last24h,
            lastWeek,
            avgPerDay,
            clicked,
            dismissed,
            total == 0 ? 0.0 : (double) clicked / total,
            total == 0 ? 0.0 : (double) dismissed / total
        );
    }

    /**
     * Records from the last {@code minutes} minutes, newest first.
     */
    public synchronized List<NotificationRecord> recentRecords(int minutes) {
        long cutoff = clock.millis() - TimeUnit.MINUTES.toMillis(minutes);
        return records.stream()
            .filter(r -> r.timestamp() > cutoff)
            .sorted(Comparator.comparingLong(NotificationRecord::timestamp).reversed())
            .toList();
    }

    /**
     * Drop records older than {@code maxAgeDays}.
     *
     * @return number of records removed
     */
    public synchronized int cleanup(int maxAgeDays) {
        long cutoff = clock.millis() - TimeUnit.DAYS.toMillis(maxAgeDays);
        int before = records.size();
        records.removeIf(r -> r.timestamp() <= cutoff);
        int removed = before - records.size();
        if (removed > 0) {
            persist();
            log.info("[GATE] Cleaned up {} notification records older than {} days", removed, maxAgeDays);
        }
        return removed;
    }

    private void persist() {
        try {
            repository.saveAll(List.copyOf(records));
        } catch (IOException e) {
            // Records stay in memory; the next mutation retries the write
            log.error("[GATE] Failed to persist {} notification records: {}", records.size(), e.getMessage());
        }
    }
}
