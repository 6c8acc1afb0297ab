package app.focustrack.infrastructure.persistence;

import app.focustrack.domain.notification.NotificationCategory;
import app.focustrack.domain.notification.NotificationInteraction;
import app.focustrack.domain.notification.NotificationRecord;
import app.focustrack.support.LogCapture;
import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JsonlNotificationRepositoryTest {

    @TempDir
    Path storageDir;

    @Test
    void testLoadFromMissingFileIsEmpty() throws IOException {
        assertTrue(new JsonlNotificationRepository(storageDir).loadAll().isEmpty());
    }

    @Test
    void testSaveWritesOneSnakeCaseLinePerRecord() throws IOException {
        JsonlNotificationRepository repository = new JsonlNotificationRepository(storageDir);
        NotificationRecord record = new NotificationRecord("n-1", NotificationCategory.IDLE_WARNING, "Focus",
            1_700_000_000_000L, Map.of("idle_duration", 600), new NotificationInteraction(true, null, 1_700_000_005_000L));

        repository.saveAll(List.of(record,
            new NotificationRecord("n-2", NotificationCategory.GOOD_JOB, "Nice", 1_700_000_100_000L, null, null)));

        List<String> lines = Files.readAllLines(repository.file());
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"category\":\"idle_warning\""), lines.get(0));
        assertTrue(lines.get(0).contains("\"interaction_timestamp\":1700000005000"), lines.get(0));
        assertFalse(lines.get(0).contains("\"dismissed\""), "Unreported flags are omitted");
        assertFalse(Files.exists(storageDir.resolve("notifications.jsonl.tmp")));
    }

    @Test
    void testMalformedLinesAreSkipped() throws IOException {
        JsonlNotificationRepository repository = new JsonlNotificationRepository(storageDir);
        repository.saveAll(List.of(new NotificationRecord("n-1", NotificationCategory.GOOD_JOB, "Nice",
            1_700_000_000_000L, Map.of(), null)));
        Files.writeString(repository.file(), "garbage\n{\"id\":\"x\",\"category\":\"bogus\"}\n",
            StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        try (LogCapture logs = LogCapture.of(JsonlNotificationRepository.class)) {
            List<NotificationRecord> loaded = repository.loadAll();

            assertEquals(1, loaded.size());
            assertEquals("n-1", loaded.get(0).id());
            assertEquals(2, logs.messages(Level.WARN).size());
        }
    }

    @Test
    void testInvalidUtf8LineDoesNotHideOtherRecords() throws IOException {
        JsonlNotificationRepository repository = new JsonlNotificationRepository(storageDir);
        repository.saveAll(List.of(new NotificationRecord("n-1", NotificationCategory.GOOD_JOB, "Nice",
            1_700_000_000_000L, Map.of(), null)));
        Files.write(repository.file(), new byte[] {(byte) 0xC3, (byte) 0x28, '\n'}, StandardOpenOption.APPEND);
        Files.writeString(repository.file(),
            "{\"id\":\"n-2\",\"category\":\"idle_warning\",\"message\":\"Focus\",\"timestamp\":1700000100000}\n",
            StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        List<NotificationRecord> loaded = repository.loadAll();

        assertEquals(List.of("n-1", "n-2"), loaded.stream().map(NotificationRecord::id).collect(Collectors.toList()));
    }
}
