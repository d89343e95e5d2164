package com.interaction.clustering.store;

import com.interaction.clustering.core.exception.CapacityExceededException;
import com.interaction.clustering.core.exception.StorageIOException;
import com.interaction.clustering.metrics.MetricsService;
import com.interaction.clustering.metrics.NoOpMetricsService;
import org.rocksdb.RocksDBException;
import org.rocksdb.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Runs storage operations with bounded retries and exponential backoff.
 *
 * <p>Failures are classified as:</p>
 * <ul>
 *   <li>capacity: the backend reports no space left; thrown at once as {@link CapacityExceededException}</li>
 *   <li>transient: I/O errors, busy, timed out, try-again, incomplete, aborted; retried up to
 *       {@code maxRetries} times, then thrown as {@link StorageIOException}</li>
 *   <li>fatal: anything else (corruption, invalid argument...); thrown at once as {@link StorageIOException}</li>
 * </ul>
 */
public class StorageRetry {
    private static final Logger log = LoggerFactory.getLogger(StorageRetry.class);
    private static final long MAX_BACKOFF_MS = 30_000;

    enum Failure { TRANSIENT, CAPACITY, FATAL }

    private final int maxRetries;
    private final long backoffMs;
    private final MetricsService metricsService;

    public StorageRetry(int maxRetries, long backoffMs) {
        this(maxRetries, backoffMs, new NoOpMetricsService());
    }

    public StorageRetry(int maxRetries, long backoffMs, MetricsService metricsService) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (backoffMs <= 0) {
            throw new IllegalArgumentException("backoffMs must be > 0");
        }
        this.maxRetries = maxRetries;
        this.backoffMs = backoffMs;
        this.metricsService = metricsService;
    }

    /**
     * Default policy: 3 retries starting at 100ms.
     */
    public static StorageRetry defaults() {
        return new StorageRetry(3, 100);
    }

    public <T> T call(String operation, StorageCall<T> call) {
        for (int attempt = 0; ; attempt++) {
            try {
                return call.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                Failure failure = classify(e);
                if (failure == Failure.CAPACITY) {
                    log.error("storage.full operation={} error={}", operation, e.getMessage());
                    throw new CapacityExceededException("Storage is full during " + operation, e);
                }
                if (failure == Failure.FATAL) {
                    log.error("storage.failed operation={} error={}", operation, e.getMessage());
                    throw new StorageIOException("Storage operation " + operation + " failed", e);
                }
                if (attempt >= maxRetries) {
                    log.error("storage.retries.exhausted operation={} attempts={} error={}",
                            operation, attempt + 1, e.getMessage());
                    throw new StorageIOException(
                            "Storage operation " + operation + " failed after " + (attempt + 1) + " attempts", e);
                }
                long delay = Math.min(backoffMs << Math.min(attempt, 20), MAX_BACKOFF_MS);
                log.warn("storage.retry operation={} attempt={} delayMs={} error={}",
                        operation, attempt + 1, delay, e.getMessage());
                metricsService.incrementStorageRetry(operation);
                sleep(delay, operation, e);
            }
        }
    }

    public void run(String operation, StorageAction action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    static Failure classify(Throwable t) {
        if (t instanceof RocksDBException rocks) {
            Status status = rocks.getStatus();
            if (status == null) {
                return Failure.FATAL;
            }
            if (status.getSubCode() == Status.SubCode.NoSpace) {
                return Failure.CAPACITY;
            }
            return switch (status.getCode()) {
                case IOError, Busy, TimedOut, TryAgain, Incomplete, Aborted -> Failure.TRANSIENT;
                default -> Failure.FATAL;
            };
        }
        if (t instanceof IOException) {
            return Failure.TRANSIENT;
        }
        return Failure.FATAL;
    }

    private static void sleep(long delay, String operation, Exception cause) {
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            StorageIOException ex = new StorageIOException("Interrupted while retrying " + operation, cause);
            ex.addSuppressed(ie);
            throw ex;
        }
    }

    /**
     * A storage operation without a result.
     */
    @FunctionalInterface
    public interface StorageAction {
        void run() throws Exception;
    }
}
