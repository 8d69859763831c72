package com.urbanparking.availability.service;

import com.urbanparking.availability.dto.RawBayRecord;
import com.urbanparking.availability.dto.RefreshResult;
import com.urbanparking.availability.exception.IngestException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Front door for refresh requests.
 *
 * At most one pending request is held. A request that arrives while another is still
 * pending replaces its input, and both callers receive the result of the single build
 * that follows. Builds run one at a time on the refresh executor.
 */
@Component
@Slf4j
public class RefreshQueue {

    private final RefreshCoordinator coordinator;
    private final Executor executor;

    private final Object lock = new Object();

    // guarded by lock
    private PendingRefresh pending;
    private boolean draining;

    public RefreshQueue(RefreshCoordinator coordinator, @Qualifier("refreshExecutor") Executor executor) {
        this.coordinator = coordinator;
        this.executor = executor;
    }

    public CompletableFuture<RefreshResult> submit(List<RawBayRecord> records, Collection<String> streets) {
        CompletableFuture<RefreshResult> result;
        boolean startDrain = false;

        synchronized (lock) {
            if (pending == null) {
                pending = new PendingRefresh(records, streets, new CompletableFuture<>());
            } else {
                log.warn("Coalescing refresh request ({} records) into the pending build",
                        records != null ? records.size() : 0);
                pending = new PendingRefresh(records, streets, pending.result);
            }
            result = pending.result;
            if (!draining) {
                draining = true;
                startDrain = true;
            }
        }

        if (startDrain) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                PendingRefresh rejected;
                synchronized (lock) {
                    rejected = pending;
                    pending = null;
                    draining = false;
                }
                log.error("Refresh executor rejected the build", e);
                if (rejected != null) {
                    rejected.result.completeExceptionally(new IngestException("Refresh could not be scheduled", e));
                }
            }
        }
        return result;
    }

    /**
     * Submit and wait for the build that covers this request.
     *
     * @throws IngestException if the build failed or the wait was interrupted
     */
    public RefreshResult submitAndWait(List<RawBayRecord> records, Collection<String> streets) {
        try {
            return submit(records, streets).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IngestException("Refresh failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestException("Interrupted while waiting for refresh", e);
        }
    }

    private void drain() {
        while (true) {
            PendingRefresh next;
            synchronized (lock) {
                next = pending;
                pending = null;
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                next.result.complete(coordinator.refresh(next.records, next.streets));
            } catch (RuntimeException e) {
                next.result.completeExceptionally(e);
            }
        }
    }

    private static final class PendingRefresh {
        final List<RawBayRecord> records;
        final Collection<String> streets;
        final CompletableFuture<RefreshResult> result;

        PendingRefresh(List<RawBayRecord> records, Collection<String> streets,
                       CompletableFuture<RefreshResult> result) {
            this.records = records;
            this.streets = streets != null ? streets : Collections.emptyList();
            this.result = result;
        }
    }
}
