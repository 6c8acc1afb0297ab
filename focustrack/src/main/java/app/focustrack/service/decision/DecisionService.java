package app.focustrack.service.decision;

import app.focustrack.domain.decision.DecisionContext;
import app.focustrack.domain.decision.DecisionVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the active decision provider with a bounded timeout.
 *
 * Callers always receive a valid verdict: any exception, or a provider that
 * does not answer within the timeout, yields the deterministic fallback.
 */
public final class DecisionService {
    private static final Logger log = LoggerFactory.getLogger(DecisionService.class);

    private final FallbackDecisionProvider fallback;
    private final Duration timeout;
    private final ExecutorService executor;
    private volatile DecisionProvider provider;

    public DecisionService(DecisionProvider provider, FallbackDecisionProvider fallback, Duration timeout) {
        this.provider = provider;
        this.fallback = fallback;
        this.timeout = timeout;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "DecisionProvider-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Ask the active provider; completes with the fallback verdict on failure or timeout.
     */
    public CompletableFuture<DecisionVerdict> decideAsync(DecisionContext context) {
        DecisionProvider current = provider;
        if (current == fallback) {
            return CompletableFuture.completedFuture(fallback.generate(context));
        }

        CompletableFuture<DecisionVerdict> call = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    call.complete(current.generate(context));
                } catch (Exception e) {
                    call.completeExceptionally(e);
                }
            });
        } catch (Exception e) {
            log.error("[DECISION] Could not start {} provider call: {}", current.name(), e.getMessage());
            return CompletableFuture.completedFuture(fallback.substituteFor(current.name(), context));
        }

        return call
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((verdict, error) -> {
                if (error == null && verdict != null) {
                    log.info("[DECISION] {} verdict: notify={}, confidence={}",
                        current.name(), verdict.shouldNotify(), verdict.confidence());
                    return verdict;
                }
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
                if (cause instanceof TimeoutException) {
                    // Releases the pool thread of a hung provider
                    task.cancel(true);
                    log.warn("[DECISION] {} provider timed out after {}ms, using fallback",
                        current.name(), timeout.toMillis());
                } else if (cause != null) {
                    log.error("[DECISION] {} provider failed, using fallback: {}", current.name(), cause.getMessage());
                } else {
                    log.error("[DECISION] {} provider returned no verdict, using fallback", current.name());
                }
                return fallback.substituteFor(current.name(), context);
            });
    }

    /**
     * Blocking form of {@link #decideAsync}; returns within the timeout.
     */
    public DecisionVerdict decide(DecisionContext context) {
        return decideAsync(context).join();
    }

    /**
     * Swap the active provider. Calls already in flight finish on the old one.
     */
    public void setProvider(DecisionProvider newProvider) {
        this.provider = newProvider == null ? fallback : newProvider;
        log.info("[DECISION] Switched to provider: {}", this.provider.name());
    }

    public String currentProviderName() {
        return provider.name();
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
