package app.focustrack.infrastructure.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskScheduler} backed by a daemon {@link ScheduledExecutorService}.
 *
 * Usage:
 * <pre>
 * ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("focus", 2);
 * ScheduledTask check = scheduler.scheduleAtFixedRate(
 *     "idle-check", detector::tick, Duration.ofSeconds(30), Duration.ofSeconds(30));
 * check.cancel();
 * scheduler.shutdown();
 * </pre>
 */
public final class ExecutorTaskScheduler implements TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final String name;
    private final ScheduledExecutorService executor;

    public ExecutorTaskScheduler(String name, int threads) {
        this.name = name;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, name + "-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(String taskName, Runnable task, Duration initialDelay, Duration period) {
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (Exception e) {
                // An uncaught exception would cancel all later runs
                log.error("[{}] Scheduled task '{}' failed", name, taskName, e);
            }
        }, initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);

        log.debug("[{}] Scheduled '{}' every {}ms", name, taskName, period.toMillis());
        return new FutureTask(future);
    }

    /**
     * Stop all timers, waiting briefly for running tasks.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class FutureTask implements ScheduledTask {
        private final ScheduledFuture<?> future;

        FutureTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
