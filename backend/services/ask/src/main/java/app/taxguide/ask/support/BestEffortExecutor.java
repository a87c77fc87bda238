package app.taxguide.ask.support;

import app.taxguide.ask.config.AskProps;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fire-and-forget runner for non-critical writes (use counters, event log).
 * Work is bounded by a queue and a timeout; failures are logged and dropped.
 * Never use it for a write the response depends on.
 */
@Component
public class BestEffortExecutor {

    private static final Logger log = LoggerFactory.getLogger(BestEffortExecutor.class);

    private final ThreadPoolExecutor executor;
    private final long timeoutMs;

    public BestEffortExecutor(AskProps props) {
        AskProps.BestEffort config = props.bestEffort();
        int threads = Math.max(1, config.threads());
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                30,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, config.queueCapacity())),
                runnable -> {
                    Thread thread = new Thread(runnable, "best-effort-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
        this.executor.allowCoreThreadTimeOut(true);
        this.timeoutMs = config.timeoutMs() > 0 ? config.timeoutMs() : 2000;
    }

    public CompletableFuture<Void> submit(String label, Runnable task) {
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(task, executor);
        } catch (RejectedExecutionException ex) {
            log.warn("Best-effort task dropped task={} reason=queue_full", label);
            return CompletableFuture.completedFuture(null);
        }
        return future
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    log.warn("Best-effort task failed task={} error={}", label, safeMessage(ex));
                    return null;
                });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }

    static String safeMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null && cause != cause.getCause()) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message.length() > 300 ? message.substring(0, 300) : message;
    }
}
