package app.focustrack.application.port.output;

import app.focustrack.domain.notification.NotificationRecord;

import java.io.IOException;
import java.util.List;

/**
 * Durable storage for notification records.
 */
public interface NotificationRepository {

    /**
     * Load every stored record; unreadable entries are skipped.
     */
    List<NotificationRecord> loadAll() throws IOException;

    /**
     * Replace the stored records with {@code records}.
     */
    void saveAll(List<NotificationRecord> records) throws IOException;
}
