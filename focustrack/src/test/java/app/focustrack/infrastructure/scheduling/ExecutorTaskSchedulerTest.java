package app.focustrack.infrastructure.scheduling;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorTaskSchedulerTest {

    private final ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler("test", 1);

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void testRunsPeriodically() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(3);

        scheduler.scheduleAtFixedRate("tick", latch::countDown, Duration.ZERO, Duration.ofMillis(50));

        assertTrue(latch.await(2, TimeUnit.SECONDS), "Should run 3 times within 2 seconds");
    }

    @Test
    void testFailingTaskKeepsRunning() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(3);

        scheduler.scheduleAtFixedRate("flaky", () -> {
            latch.countDown();
            throw new IllegalStateException("boom");
        }, Duration.ZERO, Duration.ofMillis(50));

        assertTrue(latch.await(2, TimeUnit.SECONDS), "Exceptions must not cancel later runs");
    }

    @Test
    void testCancelStopsRuns() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        ScheduledTask task = scheduler.scheduleAtFixedRate("tick", runs::incrementAndGet,
            Duration.ofMillis(500), Duration.ofMillis(500));

        task.cancel();
        Thread.sleep(700);

        assertTrue(task.isCancelled());
        assertEquals(0, runs.get());
    }
}
