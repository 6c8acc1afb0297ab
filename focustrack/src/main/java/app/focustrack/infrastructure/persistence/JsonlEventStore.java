package app.focustrack.infrastructure.persistence;

import app.focustrack.application.port.output.EventStore;
import app.focustrack.domain.activity.ActivityCategory;
import app.focustrack.domain.activity.ActivityEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event store writing one JSON object per line into daily partition files
 * ({@code activity_yyyy-MM-dd.jsonl}, UTC date of the flush).
 *
 * Guarantees:
 * - Append order is preserved within a session
 * - The buffer is cleared only after a successful write (at-least-once)
 * - Range queries tolerate corrupt lines and return events sorted by timestamp
 *
 * Usage:
 * <pre>
 * try (EventStore store = new JsonlEventStore(dir, 100, Clock.systemUTC())) {
 *     store.log(ActivityCategory.WINDOW_CHANGE, new WindowPayload("IDE", "Main.java", "idea"));
 *     List&lt;ActivityEvent&gt; lastHour = store.queryRecent(60);
 * }
 * </pre>
 */
public final class JsonlEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(JsonlEventStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String FILE_PREFIX = "activity_";
    static final String FILE_SUFFIX = ".jsonl";

    // Warn about an unflushed backlog once it exceeds this many batches
    private static final int BACKLOG_WARN_BATCHES = 10;

    private final Path storageDir;
    private final int batchSize;
    private final Clock clock;
    private final Executor flushExecutor;
    private final ExecutorService ownedExecutor;    // null when the executor was supplied
    private final String sessionId = UUID.randomUUID().toString();

    private final Object bufferLock = new Object();
    private final List<ActivityEvent> buffer = new ArrayList<>();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicBoolean autoFlushPending = new AtomicBoolean(false);
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    public JsonlEventStore(Path storageDir, int batchSize, Clock clock) {
        this(storageDir, batchSize, clock, null);
    }

    /**
     * @param flushExecutor executor for automatic flushes and async queries;
     *                      null creates a private single daemon thread
     */
    public JsonlEventStore(Path storageDir, int batchSize, Clock clock, Executor flushExecutor) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.storageDir = storageDir;
        this.batchSize = batchSize;
        this.clock = clock;
        if (flushExecutor == null) {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "EventStore-flush");
                t.setDaemon(true);
                return t;
            });
            this.flushExecutor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.flushExecutor = flushExecutor;
        }

        try {
            Files.createDirectories(storageDir);
        } catch (IOException e) {
            log.error("[EVENT STORE] Failed to create storage directory {}: {}", storageDir, e.getMessage());
        }
        log.info("[EVENT STORE] Session {} writing to {} (batch size {})", sessionId, storageDir, batchSize);
    }

    // ═══════════════════════════════════════════════════════════════
    // APPEND
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void append(ActivityEvent event) {
        int size;
        synchronized (bufferLock) {
            buffer.add(event);
            size = buffer.size();
        }
        log.debug("[EVENT STORE] {} {}", event.category().wireValue(), event.payload());

        if (size >= batchSize * BACKLOG_WARN_BATCHES && size % batchSize == 0) {
            log.warn("[EVENT STORE] {} events buffered without a successful flush to {}", size, storageDir);
        }

        if (size >= batchSize) {
            triggerAutoFlush();
        }
    }

    @Override
    public ActivityEvent log(ActivityCategory category, Object payload) {
        ActivityEvent event = ActivityEvent.create(clock.millis(), category, payload, sessionId);
        append(event);
        return event;
    }

    private void triggerAutoFlush() {
        if (!autoFlushPending.compareAndSet(false, true)) {
            return;  // a flush is already queued and will pick up this event
        }
        try {
            flushExecutor.execute(() -> {
                try {
                    flush();
                } finally {
                    autoFlushPending.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            autoFlushPending.set(false);
            log.warn("[EVENT STORE] Automatic flush rejected, events stay buffered: {}", e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // FLUSH
    // ═══════════════════════════════════════════════════════════════

    @Override
    public boolean flush() {
        flushLock.lock();
        try {
            List<ActivityEvent> snapshot;
            synchronized (bufferLock) {
                if (buffer.isEmpty()) {
                    return true;
                }
                snapshot = new ArrayList<>(buffer);
            }

            Path file = partitionFile(LocalDate.ofInstant(Instant.ofEpochMilli(clock.millis()), ZoneOffset.UTC));
            try {
                StringBuilder lines = new StringBuilder();
                for (ActivityEvent event : snapshot) {
                    lines.append(MAPPER.writeValueAsString(event)).append('\n');
                }

                Files.createDirectories(storageDir);
                try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    writer.write(lines.toString());
                }
            } catch (IOException e) {
                log.error("[EVENT STORE] Failed to flush {} events to {}, keeping them buffered: {}",
                    snapshot.size(), file, e.getMessage(), e);
                return false;
            }

            // Only flush() removes from the buffer and it holds flushLock, so the
            // snapshot is still the buffer's prefix
            synchronized (bufferLock) {
                buffer.subList(0, snapshot.size()).clear();
            }
            log.info("[EVENT STORE] Flushed {} events to {}", snapshot.size(), file.getFileName());
            return true;
        } finally {
            flushLock.unlock();
        }
    }

    @Override
    public CompletableFuture<Boolean> flushAsync() {
        return CompletableFuture.supplyAsync(this::flush, flushExecutor);
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    @Override
    public List<ActivityEvent> queryRange(long startMillis, long endMillis) {
        // Keyed by id: a retried flush after a partial write can leave duplicates on disk
        Map<String, ActivityEvent> byId = new LinkedHashMap<>();
        LocalDate firstDay = LocalDate.ofInstant(Instant.ofEpochMilli(startMillis), ZoneOffset.UTC);

        for (Path file : partitionFiles()) {
            LocalDate day = partitionDate(file);
            // Events are never flushed before they are created
            if (day != null && day.isBefore(firstDay)) {
                continue;
            }
            readPartition(file, startMillis, endMillis, byId);
        }

        synchronized (bufferLock) {
            for (ActivityEvent event : buffer) {
                if (event.timestamp() >= startMillis && event.timestamp() <= endMillis) {
                    byId.putIfAbsent(event.id(), event);
                }
            }
        }

        List<ActivityEvent> result = new ArrayList<>(byId.values());
        result.sort(Comparator.comparingLong(ActivityEvent::timestamp));
        return result;
    }

    @Override
    public CompletableFuture<List<ActivityEvent>> queryRangeAsync(long startMillis, long endMillis) {
        return CompletableFuture.supplyAsync(() -> queryRange(startMillis, endMillis), flushExecutor);
    }

    @Override
    public List<ActivityEvent> queryRecent(int minutes) {
        long end = clock.millis();
        long start = end - TimeUnit.MINUTES.toMillis(minutes);
        return queryRange(start, end);
    }

    private void readPartition(Path file, long startMillis, long endMillis, Map<String, ActivityEvent> sink) {
        List<String> lines;
        try {
            lines = JsonlLines.read(file);
        } catch (IOException e) {
            log.error("[EVENT STORE] Failed to read {}: {}", file, e.getMessage());
            return;
        }

        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            ActivityEvent event;
            try {
                event = MAPPER.readValue(line, ActivityEvent.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[EVENT STORE] Skipping malformed line {} in {}: {}",
                    lineNo, file.getFileName(), e.getMessage());
                continue;
            }
            if (event == null) {
                log.warn("[EVENT STORE] Skipping empty record at line {} in {}", lineNo, file.getFileName());
                continue;
            }
            if (event.timestamp() >= startMillis && event.timestamp() <= endMillis) {
                sink.putIfAbsent(event.id(), event);
            }
        }
    }

    private List<Path> partitionFiles() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(storageDir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(storageDir, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : stream) {
                files.add(file);
            }
        } catch (IOException e) {
            log.error("[EVENT STORE] Failed to list partitions in {}: {}", storageDir, e.getMessage());
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }

    Path partitionFile(LocalDate day) {
        return storageDir.resolve(FILE_PREFIX + day + FILE_SUFFIX);
    }

    static LocalDate partitionDate(Path file) {
        String name = file.getFileName().toString();
        String date = name.substring(FILE_PREFIX.length(), name.length() - FILE_SUFFIX.length());
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public int bufferedCount() {
        synchronized (bufferLock) {
            return buffer.size();
        }
    }

    @Override
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        log.info("[EVENT STORE] Shutting down, flushing {} buffered events", bufferedCount());
        if (!flush()) {
            log.error("[EVENT STORE] Final flush failed, {} events were not persisted", bufferedCount());
        }

        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
