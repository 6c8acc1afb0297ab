package app.focustrack.infrastructure.persistence;

import app.focustrack.application.port.output.NotificationRepository;
import app.focustrack.domain.notification.NotificationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Notification records in {@code notifications.jsonl}, one JSON object per line.
 * Records are mutable (interactions arrive later), so the file is rewritten
 * through a temp file and an atomic move.
 */
public final class JsonlNotificationRepository implements NotificationRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonlNotificationRepository.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String FILE_NAME = "notifications.jsonl";

    private final Path file;

    public JsonlNotificationRepository(Path storageDir) {
        this.file = storageDir.resolve(FILE_NAME);
    }

    @Override
    public List<NotificationRecord> loadAll() throws IOException {
        List<NotificationRecord> records = new ArrayList<>();
        if (!Files.exists(file)) {
            return records;
        }

        int lineNo = 0;
        for (String line : JsonlLines.read(file)) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                NotificationRecord record = MAPPER.readValue(line, NotificationRecord.class);
                if (record != null && record.id() != null && record.category() != null) {
                    records.add(record);
                }
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[NOTIFICATIONS] Skipping malformed line {} in {}: {}", lineNo, file, e.getMessage());
            }
        }
        return records;
    }

    @Override
    public void saveAll(List<NotificationRecord> records) throws IOException {
        Files.createDirectories(file.getParent());
        Path tmp = file.resolveSibling(FILE_NAME + ".tmp");

        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            for (NotificationRecord record : records) {
                writer.write(MAPPER.writeValueAsString(record));
                writer.write('\n');
            }
        }

        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public Path file() {
        return file;
    }
}
