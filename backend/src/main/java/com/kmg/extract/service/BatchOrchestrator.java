package com.kmg.extract.service;

import com.kmg.extract.model.BatchRequest;
import com.kmg.extract.model.BatchRun;
import com.kmg.extract.model.BatchStatus;
import com.kmg.extract.model.ClassifiedError;
import com.kmg.extract.model.DispatchResult;
import com.kmg.extract.model.ErrorKind;
import com.kmg.extract.model.ItemResult;
import com.kmg.extract.model.RunSummary;
import com.kmg.extract.model.WorkItem;
import com.kmg.extract.model.WorkItemStatus;
import com.kmg.extract.repo.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BooleanSupplier;

/**
 * Drives a slice of the backlog through the {@link RequestDispatcher}.
 * <p>
 * Items whose result is already persisted as succeeded are skipped without dispatch. Every other
 * outcome is persisted before the worker claims its next item. Workers claim indices from a shared
 * cursor, so an item is never in flight twice. When the pool has no usable credential the whole run
 * pauses and the affected item stays pending. Interrupting the calling thread stops the run the same
 * way a stop request does, leaving the in-flight item pending.
 */
@Service
public class BatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);
    public static final int MAX_WORKERS = 8;

    private final RequestDispatcher dispatcher;
    private final ResultStore resultStore;

    public BatchOrchestrator(RequestDispatcher dispatcher, ResultStore resultStore) {
        this.dispatcher = dispatcher;
        this.resultStore = resultStore;
    }

    public BatchRun run(BatchRequest request) {
        return run(request, () -> false, BatchProgressListener.NONE);
    }

    public BatchRun run(BatchRequest request, BooleanSupplier stopRequested, BatchProgressListener listener) {
        OffsetDateTime startedAt = OffsetDateTime.now(ZoneOffset.UTC);
        long startNanos = System.nanoTime();

        int start = Math.min(Math.max(0, request.startIndex()), request.backlog().size());
        int end = request.sliceEnd();
        RunState state = new RunState(request, start, end, stopRequested, listener);

        int workers = Math.max(1, Math.min(Math.min(request.workers(), MAX_WORKERS), end - start));
        log.info("Batch started: slice [{}, {}) of {} item(s), workers={}, output={}",
                start, end, request.backlog().size(), workers, request.outputLocation());

        if (workers == 1) {
            workLoop(state);
        } else {
            runParallel(state, workers);
        }

        RunSummary summary = summarize(state, startedAt, System.nanoTime() - startNanos);
        boolean interrupted = Thread.interrupted();
        try {
            resultStore.writeSummary(request.outputLocation(), summary);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Batch {}: succeeded={}, failed={}, skipped={}, pending={}, nextIndex={}",
                summary.status(), summary.succeeded(), summary.failed(), summary.skipped(),
                summary.pending(), summary.nextIndex());

        List<WorkItem> items = new ArrayList<>();
        for (int i = 0; i < state.slots.length(); i++) {
            WorkItem item = state.slots.get(i);
            if (item != null) {
                items.add(item);
            }
        }
        return new BatchRun(start, request.limit(), request.outputLocation(), summary, items);
    }

    private void runParallel(RunState state, int workers) {
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                futures.add(executor.submit(() -> workLoop(state)));
            }
            RuntimeException failure = null;
            for (Future<?> future : futures) {
                boolean done = false;
                while (!done) {
                    try {
                        future.get();
                        done = true;
                    } catch (ExecutionException e) {
                        state.aborted.set(true);
                        if (failure == null) {
                            failure = e.getCause() instanceof RuntimeException runtime
                                    ? runtime
                                    : new RuntimeException("Batch worker failed: " + e.getCause().getMessage(), e.getCause());
                        }
                        done = true;
                    } catch (InterruptedException e) {
                        // Workers finish or abandon their current item before the summary is taken.
                        if (state.interrupted.compareAndSet(false, true)) {
                            log.info("Batch interrupted; waiting for workers to stop");
                            executor.shutdownNow();
                        }
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        } finally {
            executor.shutdownNow();
            if (state.interrupted.get()) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void workLoop(RunState state) {
        while (!state.paused.get() && !state.aborted.get() && !state.interrupted.get()) {
            if (state.stopRequested.getAsBoolean()) {
                log.info("Stop requested; no further items claimed");
                return;
            }
            if (Thread.currentThread().isInterrupted()) {
                state.interrupted.set(true);
                log.info("Interrupted; no further items claimed");
                return;
            }
            int index = state.cursor.getAndIncrement();
            if (index >= state.end) {
                return;
            }

            WorkItem item = new WorkItem(state.request.backlog().get(index));
            state.slots.set(index - state.start, item);
            try {
                processItem(state, item);
            } catch (RuntimeException e) {
                state.aborted.set(true);
                throw e;
            }
        }
    }

    private void processItem(RunState state, WorkItem item) {
        Optional<ItemResult> existing = resultStore.readItemResult(state.request.outputLocation(), item.getItemKey());
        if (existing.isPresent() && existing.get().status() == WorkItemStatus.SUCCEEDED) {
            item.setStatus(WorkItemStatus.SUCCEEDED);
            state.skipped.incrementAndGet();
            log.debug("Item {} ({}) already succeeded; skipped", item.getIndex(), item.getItemKey());
            state.listener.itemFinished(item, true);
            return;
        }

        item.setStatus(WorkItemStatus.IN_PROGRESS);
        state.listener.itemStarted(item);

        DispatchResult result = dispatcher.dispatch(item.getSourceRef(), state.request.profile());
        if (result.interrupted()) {
            item.setStatus(WorkItemStatus.PENDING);
            state.interrupted.set(true);
            log.info("Item {} ({}) left pending after interrupt", item.getIndex(), item.getItemKey());
            return;
        }
        item.addAttempts(result.attempts());

        if (!result.succeeded() && result.error().kind() == ErrorKind.NO_USABLE_CREDENTIAL) {
            item.setStatus(WorkItemStatus.PENDING);
            item.setLastError(result.error());
            if (state.paused.compareAndSet(false, true)) {
                log.warn("Batch paused at item {}: {}", item.getIndex(), result.error().message());
            }
            state.listener.paused(item, result.error());
            return;
        }

        if (result.succeeded()) {
            item.setStatus(WorkItemStatus.SUCCEEDED);
        } else {
            item.setStatus(isPermanent(result.error()) ? WorkItemStatus.FAILED_PERMANENT : WorkItemStatus.FAILED_RETRYABLE);
            item.setLastError(result.error());
        }

        ItemResult itemResult = new ItemResult(
                item.getItemKey(),
                item.getIndex(),
                item.getSourceRef(),
                item.getStatus(),
                item.getAttempts(),
                result.payload(),
                result.error(),
                result.credentialId(),
                OffsetDateTime.now(ZoneOffset.UTC).toString()
        );
        // A completed call is kept even if an interrupt arrived meanwhile; interruptible channels
        // would otherwise close under the write.
        boolean interrupted = Thread.interrupted();
        try {
            resultStore.writeItemResult(state.request.outputLocation(), itemResult);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        switch (item.getStatus()) {
            case SUCCEEDED -> state.succeeded.incrementAndGet();
            case FAILED_PERMANENT -> state.failedPermanent.incrementAndGet();
            default -> state.failedRetryable.incrementAndGet();
        }
        if (item.getStatus() == WorkItemStatus.SUCCEEDED) {
            log.info("Item {} ({}) succeeded after {} attempt(s)", item.getIndex(), item.getItemKey(), item.getAttempts());
        } else {
            log.warn("Item {} ({}) {}: {} {}", item.getIndex(), item.getItemKey(), item.getStatus(),
                    result.error().kind(), result.error().message());
        }
        state.listener.itemFinished(item, false);
    }

    private boolean isPermanent(ClassifiedError error) {
        return error.kind() == ErrorKind.PERMANENT_FAILURE || error.kind() == ErrorKind.UNREADABLE;
    }

    private RunSummary summarize(RunState state, OffsetDateTime startedAt, long elapsedNanos) {
        int sliceSize = state.end - state.start;
        int terminal = state.succeeded.get() + state.failedRetryable.get() + state.failedPermanent.get() + state.skipped.get();

        int nextIndex = state.end;
        for (int i = 0; i < sliceSize; i++) {
            WorkItem item = state.slots.get(i);
            if (item == null || !item.getStatus().isTerminal()) {
                nextIndex = state.start + i;
                break;
            }
        }

        BatchStatus status;
        if (state.paused.get()) {
            status = BatchStatus.PAUSED;
        } else if (terminal < sliceSize) {
            status = BatchStatus.STOPPED;
        } else {
            status = BatchStatus.COMPLETED;
        }

        return new RunSummary(
                status,
                state.start,
                state.request.limit(),
                sliceSize,
                state.succeeded.get(),
                state.failedRetryable.get(),
                state.failedPermanent.get(),
                state.skipped.get(),
                sliceSize - terminal,
                nextIndex,
                elapsedNanos / 1_000_000,
                startedAt.toString(),
                OffsetDateTime.now(ZoneOffset.UTC).toString()
        );
    }

    private static class RunState {
        private final BatchRequest request;
        private final int start;
        private final int end;
        private final BooleanSupplier stopRequested;
        private final BatchProgressListener listener;
        private final AtomicInteger cursor;
        private final AtomicReferenceArray<WorkItem> slots;
        private final AtomicBoolean paused = new AtomicBoolean();
        private final AtomicBoolean aborted = new AtomicBoolean();
        private final AtomicBoolean interrupted = new AtomicBoolean();
        private final AtomicInteger succeeded = new AtomicInteger();
        private final AtomicInteger failedRetryable = new AtomicInteger();
        private final AtomicInteger failedPermanent = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();

        RunState(BatchRequest request, int start, int end, BooleanSupplier stopRequested, BatchProgressListener listener) {
            this.request = request;
            this.start = start;
            this.end = end;
            this.stopRequested = stopRequested;
            this.listener = listener;
            this.cursor = new AtomicInteger(start);
            this.slots = new AtomicReferenceArray<>(Math.max(0, end - start));
        }
    }
}
