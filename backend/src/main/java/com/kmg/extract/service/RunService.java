package com.kmg.extract.service;

import com.kmg.extract.config.ExtractorProperties;
import com.kmg.extract.dto.RunView;
import com.kmg.extract.dto.StartRunRequest;
import com.kmg.extract.model.BacklogEntry;
import com.kmg.extract.model.BatchRequest;
import com.kmg.extract.model.BatchRun;
import com.kmg.extract.model.ClassifiedError;
import com.kmg.extract.model.RunRecord;
import com.kmg.extract.model.RunStatus;
import com.kmg.extract.model.RunSummary;
import com.kmg.extract.model.WorkItem;
import com.kmg.extract.repo.RunRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class RunService {
    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    static final String PAUSE_REASON = "No usable credential";
    static final String STOP_REASON = "Stopped by user";

    private final RunRepository runRepository;
    private final BacklogService backlogService;
    private final BatchOrchestrator orchestrator;
    private final EventService eventService;
    private final ExtractorProperties properties;

    private final ExecutorService runExecutor = Executors.newSingleThreadExecutor();
    private final Set<String> stopRequests = ConcurrentHashMap.newKeySet();
    private final AtomicReference<String> runningRunId = new AtomicReference<>(null);

    public RunService(
            RunRepository runRepository,
            BacklogService backlogService,
            BatchOrchestrator orchestrator,
            EventService eventService,
            ExtractorProperties properties
    ) {
        this.runRepository = runRepository;
        this.backlogService = backlogService;
        this.orchestrator = orchestrator;
        this.eventService = eventService;
        this.properties = properties;
    }

    public synchronized String startRun(StartRunRequest request) {
        if (runningRunId.get() != null) {
            throw new IllegalStateException("Another run is already in progress.");
        }

        String backlogDir = backlogService.normalizeFolderPath(request.backlogDir()).toString();
        List<BacklogEntry> backlog = backlogService.listBacklog(backlogDir);
        if (request.startIndex() > backlog.size()) {
            throw new IllegalArgumentException("Start index " + request.startIndex()
                    + " is beyond the backlog of " + backlog.size() + " item(s).");
        }

        String outputDir = request.outputDir() == null || request.outputDir().isBlank()
                ? properties.getOutput().getDir()
                : request.outputDir();
        outputDir = Path.of(outputDir).toAbsolutePath().normalize().toString();
        int workers = request.workers() == null ? properties.getBatch().getDefaultWorkers() : request.workers();

        String runId = UUID.randomUUID().toString();
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        BatchRequest batch = new BatchRequest(
                backlog,
                request.startIndex(),
                request.limit(),
                Path.of(outputDir),
                request.profile(),
                workers
        );
        int sliceSize = batch.sliceEnd() - Math.min(request.startIndex(), backlog.size());

        runRepository.insertRun(new RunRecord(
                runId,
                backlogDir,
                request.profile(),
                request.startIndex(),
                request.limit(),
                outputDir,
                workers,
                RunStatus.RUNNING,
                now,
                now,
                null,
                null,
                sliceSize,
                0,
                null,
                0,
                0,
                0,
                null,
                null
        ));

        runningRunId.set(runId);
        stopRequests.remove(runId);
        eventService.publish("run-started", runId, "Run started", Map.of(
                "backlogDir", backlogDir,
                "startIndex", request.startIndex(),
                "items", sliceSize
        ));

        try {
            runExecutor.submit(() -> execute(runId, batch));
        } catch (RuntimeException ex) {
            runningRunId.set(null);
            stopRequests.remove(runId);
            runRepository.failRun(runId, ex.getMessage());
            throw ex;
        }
        return runId;
    }

    /**
     * Starts a new run with the parameters of {@code runId}, beginning at its recorded next index.
     */
    public String resumeRun(String runId) {
        RunRecord previous = runRepository.findRunById(runId)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
        if (previous.status() == RunStatus.RUNNING) {
            throw new IllegalStateException("Run is still in progress: " + runId);
        }

        int nextIndex = previous.nextIndex() == null ? previous.startIndex() : previous.nextIndex();
        Integer remaining = null;
        if (previous.itemLimit() != null) {
            remaining = Math.max(0, previous.itemLimit() - (nextIndex - previous.startIndex()));
        }
        log.info("Resuming run {} from index {} (remaining limit: {})", runId, nextIndex, remaining == null ? "all" : remaining);

        return startRun(new StartRunRequest(
                previous.backlogDir(),
                previous.profile(),
                nextIndex,
                remaining,
                previous.outputDir(),
                previous.workers()
        ));
    }

    public void stopRun(String runId) {
        RunRecord run = runRepository.findRunById(runId)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
        if (run.status() != RunStatus.RUNNING) {
            throw new IllegalStateException("Run is not in progress: " + runId);
        }
        stopRequests.add(runId);
        eventService.publish("run-stop-requested", runId, "Stop requested", null);
    }

    public List<RunView> listRuns() {
        return runRepository.findRuns().stream()
                .map(this::toView)
                .toList();
    }

    public RunView getRun(String runId) {
        return runRepository.findRunById(runId)
                .map(this::toView)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
    }

    void execute(String runId, BatchRequest request) {
        AtomicInteger processed = new AtomicInteger();
        BatchProgressListener listener = new BatchProgressListener() {
            @Override
            public void itemFinished(WorkItem item, boolean skipped) {
                int done = processed.incrementAndGet();
                runRepository.updateProgress(runId, done, item.getIndex());

                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("index", item.getIndex());
                payload.put("itemKey", item.getItemKey());
                payload.put("status", item.getStatus());
                payload.put("attempts", item.getAttempts());
                payload.put("skipped", skipped);
                payload.put("processedItems", done);
                if (item.getLastError() != null) {
                    payload.put("error", item.getLastError());
                }
                eventService.publish("item-finished", runId, "Item finished", payload);
            }

            @Override
            public void paused(WorkItem item, ClassifiedError reason) {
                eventService.publish("run-paused", runId, reason.message(), Map.of("index", item.getIndex()));
            }
        };

        boolean interrupted = false;
        try {
            BatchRun result = orchestrator.run(request, () -> stopRequests.contains(runId), listener);
            // Recording the outcome must not trip over an interrupt that already stopped the batch.
            interrupted = Thread.interrupted();
            RunSummary summary = result.summary();
            switch (summary.status()) {
                case COMPLETED -> {
                    runRepository.finishRun(runId, RunStatus.COMPLETED, null, null, summary);
                    eventService.publish("run-completed", runId, "Run completed", summary);
                }
                case PAUSED -> {
                    runRepository.finishRun(runId, RunStatus.PAUSED, PAUSE_REASON, PAUSE_REASON, summary);
                    eventService.publish("run-paused", runId, "Run paused", summary);
                }
                case STOPPED -> {
                    runRepository.finishRun(runId, RunStatus.STOPPED, STOP_REASON, null, summary);
                    eventService.publish("run-stopped", runId, "Run stopped", summary);
                }
            }
        } catch (Exception e) {
            log.error("Run {} failed: {}", runId, e.getMessage(), e);
            runRepository.failRun(runId, e.getMessage());
            eventService.publish("run-failed", runId, "Run failed",
                    Map.of("error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        } finally {
            runningRunId.set(null);
            stopRequests.remove(runId);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    String runningRunId() {
        return runningRunId.get();
    }

    @PreDestroy
    public void shutdown() {
        String current = runningRunId.get();
        if (current != null) {
            stopRequests.add(current);
        }
        runExecutor.shutdownNow();
    }

    private RunView toView(RunRecord run) {
        return new RunView(
                run.id(),
                run.backlogDir(),
                run.profile(),
                run.startIndex(),
                run.itemLimit(),
                run.outputDir(),
                run.workers(),
                run.status(),
                toText(run.createdAt()),
                toText(run.startedAt()),
                toText(run.endedAt()),
                run.stopReason(),
                run.totalItems(),
                run.processedItems(),
                run.currentIndex(),
                run.succeeded(),
                run.failed(),
                run.skipped(),
                run.nextIndex(),
                run.lastError()
        );
    }

    private String toText(OffsetDateTime value) {
        return value == null ? null : value.toString();
    }
}
