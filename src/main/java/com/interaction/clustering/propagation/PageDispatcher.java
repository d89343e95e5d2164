package com.interaction.clustering.propagation;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.exception.ClusteringException;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.store.AdjacencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Parallel pass over one adjacency namespace.
 *
 * <p>The calling thread pages through the adjacency and submits each page as one task to a
 * fixed worker pool. At most twice as many pages as workers are in flight, which bounds the
 * entries held in memory. {@link #dispatch} returns only when every page has been processed,
 * so each call is a barrier.</p>
 */
public class PageDispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PageDispatcher.class);

    private final ExecutorService executor;
    private final int workers;

    public PageDispatcher(int workers) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        this.workers = workers;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "propagation-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Applies {@code task} to every page of {@code namespace} and returns the page results in page order.
     * The first task failure is rethrown once the in-flight pages have finished.
     */
    public <R> List<R> dispatch(AdjacencyStore adjacency, EntityNamespace namespace, int pageSize,
                                Function<List<AdjacencyEntry>, R> task) {
        Semaphore inFlight = new Semaphore(workers * 2);
        AtomicBoolean failed = new AtomicBoolean();
        List<CompletableFuture<R>> futures = new ArrayList<>();
        String cursor = null;
        CursorPage<AdjacencyEntry> page;
        do {
            acquire(inFlight);
            try {
                page = adjacency.scan(namespace, cursor, pageSize);
            } catch (RuntimeException e) {
                inFlight.release();
                awaitQuietly(futures);
                throw e;
            }
            List<AdjacencyEntry> entries = page.content();
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return task.apply(entries);
                } catch (RuntimeException e) {
                    failed.set(true);
                    throw e;
                } finally {
                    inFlight.release();
                }
            }, executor));
            cursor = page.nextCursor();
        } while (page.hasMore() && !failed.get());

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new ClusteringException("Page task failed on " + namespace, e.getCause());
        }
        List<R> results = new ArrayList<>(futures.size());
        for (CompletableFuture<R> f : futures) {
            results.add(f.join());
        }
        log.debug("dispatch.completed namespace={} pages={}", namespace, futures.size());
        return results;
    }

    private static void acquire(Semaphore semaphore) {
        try {
            semaphore.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusteringException("Interrupted while dispatching pages", e);
        }
    }

    private static void awaitQuietly(List<? extends CompletableFuture<?>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.debug("dispatch.aborted pending task failed: {}", e.getCause().getMessage());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
