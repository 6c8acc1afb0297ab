package app.focustrack.application.port.output;

import app.focustrack.domain.activity.ActivityCategory;
import app.focustrack.domain.activity.ActivityEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only, batched log of activity events.
 *
 * Appends never fail from the caller's point of view: persistence errors are
 * logged and the buffered events are retried on the next flush.
 */
public interface EventStore extends AutoCloseable {

    /**
     * Buffer an event; may trigger an automatic flush in the background.
     */
    void append(ActivityEvent event);

    /**
     * Create an event for this store's session and append it.
     *
     * @return the created event
     */
    ActivityEvent log(ActivityCategory category, Object payload);

    /**
     * Write all buffered events to durable storage.
     *
     * @return true if the buffer was persisted (or empty)
     */
    boolean flush();

    CompletableFuture<Boolean> flushAsync();

    /**
     * Events with {@code start <= timestamp <= end}, ascending by timestamp.
     */
    List<ActivityEvent> queryRange(long startMillis, long endMillis);

    CompletableFuture<List<ActivityEvent>> queryRangeAsync(long startMillis, long endMillis);

    /**
     * Events from the last {@code minutes} minutes.
     */
    List<ActivityEvent> queryRecent(int minutes);

    String sessionId();

    int bufferedCount();

    /**
     * Final flush and release of background resources.
     */
    void shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
