package com.trading.brain.persistence;

import com.trading.brain.metrics.BrainMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Writes snapshots on a single background thread so the trade path never waits on disk.
 * Submissions run in order; failures are logged and counted, never propagated.
 */
public class AsyncSnapshotWriter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AsyncSnapshotWriter.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final SnapshotStore store;
    private final BrainMetrics metrics;
    private final ScheduledExecutorService executor;

    public AsyncSnapshotWriter(SnapshotStore store, BrainMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "brain-snapshot-writer");
            thread.setDaemon(true);
            return thread;
        });
        logger.info("Snapshot writer started for {}", store.getDirectory().toAbsolutePath());
    }

    public SnapshotStore getStore() {
        return store;
    }

    /** Queues a write; the snapshot object must not be mutated afterwards. */
    public CompletableFuture<SaveResult> submit(String fileName, Object snapshot) {
        try {
            return CompletableFuture.supplyAsync(() -> write(fileName, snapshot), executor);
        } catch (RejectedExecutionException e) {
            logger.warn("Snapshot writer closed, dropping {}", fileName);
            return CompletableFuture.completedFuture(new SaveResult.Failed(store.resolve(fileName), e));
        }
    }

    /** Writes on the caller's thread. Used for the final flush on shutdown. */
    public SaveResult write(String fileName, Object snapshot) {
        SaveResult result = store.save(fileName, snapshot);
        if (result instanceof SaveResult.Failed failed) {
            metrics.recordSnapshotFailure(fileName);
            logger.error("Failed to save snapshot {}: {}", failed.path(), failed.cause().toString());
        } else {
            logger.debug("Snapshot saved: {}", result.path());
        }
        return result;
    }

    /**
     * Periodically writes whatever the supplier returns. A failing supplier is logged and the
     * schedule continues.
     */
    public ScheduledFuture<?> scheduleEvery(Duration interval, String fileName, Supplier<?> snapshot) {
        long seconds = Math.max(1, interval.toSeconds());
        return executor.scheduleAtFixedRate(() -> {
            try {
                write(fileName, snapshot.get());
            } catch (RuntimeException e) {
                metrics.recordSnapshotFailure(fileName);
                logger.error("Autosave of {} failed", fileName, e);
            }
        }, seconds, seconds, TimeUnit.SECONDS);
    }

    /** Blocks until everything queued so far has been written. */
    public void flush() {
        try {
            executor.submit(() -> { }).get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            logger.debug("Snapshot writer already closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Snapshot flush did not complete: {}", e.toString());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Snapshot writer did not drain in {}s", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Snapshot writer stopped");
    }
}
