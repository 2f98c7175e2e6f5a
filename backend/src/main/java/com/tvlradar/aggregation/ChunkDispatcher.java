package com.tvlradar.aggregation;

import com.tvlradar.config.AsyncConfig;
import com.tvlradar.domain.Chunk;
import com.tvlradar.domain.ChunkResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs planned chunks through a {@link RemoteCallExecutor} with at most {@code concurrencyLimit} chunks in flight.
 * <p>
 * Admission happens on the calling thread: a permit is taken before each chunk is submitted and released when
 * it completes. Results are stored by chunk index, so the returned list lines up with the input whatever the
 * completion order. The first failure stops admission, cancels the futures still pending and is rethrown as is,
 * without waiting for slower siblings. Cancellation does not interrupt an HTTP exchange that is already running;
 * its late result is dropped.
 */
@Component
@Slf4j
public class ChunkDispatcher {

    private final Executor executor;
    private final ProgressObserver progressObserver;

    public ChunkDispatcher(@Qualifier(AsyncConfig.AGGREGATION_EXECUTOR) Executor executor,
                           ProgressObserver progressObserver) {
        this.executor = executor;
        this.progressObserver = progressObserver != null ? progressObserver : ProgressObserver.NOOP;
    }

    public List<ChunkResult> dispatch(String operation, List<Chunk> chunks, int concurrencyLimit,
                                      RemoteCallExecutor callExecutor) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1, got " + concurrencyLimit);
        }
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }
        int total = chunks.size();
        Semaphore permits = new Semaphore(concurrencyLimit);
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        CompletableFuture<Void> failed = new CompletableFuture<>();
        AtomicReferenceArray<ChunkResult> results = new AtomicReferenceArray<>(total);
        ProgressCounter progress = new ProgressCounter(operation, total);
        List<CompletableFuture<Void>> submitted = new ArrayList<>(total);

        for (int i = 0; i < total; i++) {
            acquire(permits, submitted);
            if (firstFailure.get() != null) {
                permits.release();
                break;
            }
            Chunk chunk = chunks.get(i);
            int slot = i;
            try {
                submitted.add(CompletableFuture.runAsync(() -> {
                    try {
                        if (firstFailure.get() != null) {
                            return;
                        }
                        results.set(slot, callExecutor.execute(chunk));
                        progress.increment();
                    } catch (RuntimeException | Error e) {
                        fail(firstFailure, failed, e);
                        throw e;
                    } finally {
                        permits.release();
                    }
                }, executor));
            } catch (RejectedExecutionException e) {
                permits.release();
                fail(firstFailure, failed, e);
                break;
            }
        }

        awaitAll(submitted, failed, firstFailure);

        Throwable failure = firstFailure.get();
        if (failure != null) {
            log.warn("{} failed after {}/{} chunks: {}", operation, progress.completed(), total, failure.getMessage());
            throw rethrow(failure);
        }
        List<ChunkResult> ordered = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            ChunkResult result = results.get(i);
            if (result == null) {
                throw new BookkeepingViolationException(operation + ": chunk " + i + " produced no result");
            }
            ordered.add(result);
        }
        return ordered;
    }

    private static void acquire(Semaphore permits, List<CompletableFuture<Void>> submitted) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            submitted.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Interrupted while waiting for a dispatch slot", e);
        }
    }

    private static void fail(AtomicReference<Throwable> firstFailure, CompletableFuture<Void> failed, Throwable e) {
        if (firstFailure.compareAndSet(null, e)) {
            failed.completeExceptionally(e);
        }
    }

    /**
     * Returns when every chunk has completed or as soon as one fails, whichever comes first; on failure the
     * chunks still pending are cancelled.
     */
    private static void awaitAll(List<CompletableFuture<Void>> submitted, CompletableFuture<Void> failed,
                                 AtomicReference<Throwable> firstFailure) {
        CompletableFuture<Void> all = CompletableFuture.allOf(submitted.toArray(new CompletableFuture[0]));
        try {
            CompletableFuture.anyOf(failed, all).join();
        } catch (CompletionException | CancellationException e) {
            firstFailure.compareAndSet(null, e.getCause() != null ? e.getCause() : e);
        }
        if (firstFailure.get() != null) {
            submitted.forEach(f -> f.cancel(true));
        }
    }

    private static RuntimeException rethrow(Throwable failure) {
        if (failure instanceof RuntimeException runtime) {
            return runtime;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new CompletionException(failure);
    }

    private final class ProgressCounter {

        private final String operation;
        private final int total;
        private int completed;

        private ProgressCounter(String operation, int total) {
            this.operation = operation;
            this.total = total;
        }

        synchronized void increment() {
            completed++;
            progressObserver.onChunkCompleted(operation, completed, total);
        }

        synchronized int completed() {
            return completed;
        }
    }
}
