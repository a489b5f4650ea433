package com.paxkun.magpie.service.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * AutoCloseableExecutor wraps an ExecutorService so a batch pool can live in a
 * try-with-resources block and is always shut down when the batch ends.
 *
 * Usage Example:
 * <pre>
 * try (AutoCloseableExecutor pool = new AutoCloseableExecutor(Executors.newFixedThreadPool(4), Duration.ofMinutes(1))) {
 *     pool.executor().submit(() -> { ... });
 * }
 * </pre>
 *
 * Author: Pax
 */
@Slf4j
public record AutoCloseableExecutor(ExecutorService executor, Duration awaitTimeout) implements AutoCloseable {

    /**
     * Waits up to {@code awaitTimeout} for running tasks, then forces shutdown.
     */
    @Override
    public void close() {
        if (executor.isShutdown()) {
            log.debug("Executor already shut down, not waiting again.");
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(awaitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("⚠️ Executor did not terminate within {} ms, forced shutdown.", awaitTimeout.toMillis());
            } else {
                log.debug("✅ Executor shutdown cleanly.");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            log.error("❌ Executor shutdown interrupted: {}", e.getMessage(), e);
        }
    }

    /**
     * Interrupts running tasks and waits at most {@code grace} for them to stop.
     * A later {@link #close()} returns immediately.
     *
     * @return true if every task finished within the grace period
     */
    public boolean abort(Duration grace) {
        executor.shutdownNow();
        try {
            boolean terminated = executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                log.warn("⚠️ Executor still has running tasks {} ms after forced shutdown.", grace.toMillis());
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("❌ Interrupted while aborting executor: {}", e.getMessage(), e);
            return false;
        }
    }
}
