package com.kmg.extract.service;

import com.kmg.extract.config.ExtractorProperties;
import com.kmg.extract.dto.StartRunRequest;
import com.kmg.extract.model.BacklogEntry;
import com.kmg.extract.model.BatchRequest;
import com.kmg.extract.model.BatchRun;
import com.kmg.extract.model.BatchStatus;
import com.kmg.extract.model.InsurerProfile;
import com.kmg.extract.model.RunRecord;
import com.kmg.extract.model.RunStatus;
import com.kmg.extract.model.RunSummary;
import com.kmg.extract.repo.RunRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunServiceTest {
    private final RunRepository runRepository = mock(RunRepository.class);
    private final BacklogService backlogService = mock(BacklogService.class);
    private final BatchOrchestrator orchestrator = mock(BatchOrchestrator.class);
    private final ExtractorProperties properties = new ExtractorProperties();
    private RunService service;

    @BeforeEach
    void setUp() {
        properties.getOutput().setDir("/tmp/extractor-out");
        service = new RunService(runRepository, backlogService, orchestrator, new EventService(), properties);

        List<BacklogEntry> backlog = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            backlog.add(new BacklogEntry(i, "doc-" + i, "/backlog/doc-" + i + ".pdf"));
        }
        when(backlogService.normalizeFolderPath(anyString())).thenReturn(Path.of("/backlog"));
        when(backlogService.listBacklog(anyString())).thenReturn(backlog);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private static RunSummary summary(BatchStatus status, int nextIndex) {
        return new RunSummary(status, 0, null, 20, 5, 0, 0, 0, 15, nextIndex, 10L, "s", "e");
    }

    private static BatchRun batchRun(BatchStatus status, int nextIndex) {
        return new BatchRun(0, null, Path.of("/out"), summary(status, nextIndex), List.of());
    }

    private static RunRecord finished(String id, int startIndex, Integer limit, Integer nextIndex, RunStatus status) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        return new RunRecord(id, "/backlog", InsurerProfile.RELIANCE, startIndex, limit, "/out", 2, status,
                now, now, now, null, 10, 2, 6, 2, 0, 0, nextIndex, null);
    }

    @Test
    void startRunRecordsTheSliceAndRunsIt() {
        when(orchestrator.run(any(), any(), any())).thenReturn(batchRun(BatchStatus.COMPLETED, 20));

        String runId = service.startRun(new StartRunRequest("/backlog", InsurerProfile.RELIANCE, 4, 6, null, null));

        ArgumentCaptor<RunRecord> record = ArgumentCaptor.forClass(RunRecord.class);
        verify(runRepository).insertRun(record.capture());
        assertThat(record.getValue().id()).isEqualTo(runId);
        assertThat(record.getValue().totalItems()).isEqualTo(6);
        assertThat(record.getValue().workers()).isEqualTo(1);
        assertThat(record.getValue().outputDir()).isEqualTo(Path.of("/tmp/extractor-out").toAbsolutePath().normalize().toString());

        ArgumentCaptor<BatchRequest> batch = ArgumentCaptor.forClass(BatchRequest.class);
        verify(orchestrator, timeout(5_000)).run(batch.capture(), any(), any());
        assertThat(batch.getValue().startIndex()).isEqualTo(4);
        assertThat(batch.getValue().limit()).isEqualTo(6);
        verify(runRepository, timeout(5_000)).finishRun(eq(runId), eq(RunStatus.COMPLETED), any(), any(), any());
    }

    @Test
    void startIndexPastTheBacklogIsRejected() {
        assertThatThrownBy(() -> service.startRun(new StartRunRequest("/backlog", InsurerProfile.RELIANCE, 21, null, null, 1)))
                .isInstanceOf(IllegalArgumentException.class);
        verify(runRepository, never()).insertRun(any());
    }

    @Test
    void pausedBatchIsRecordedWithReason() {
        when(orchestrator.run(any(), any(), any())).thenReturn(batchRun(BatchStatus.PAUSED, 5));

        service.execute("run-1", new BatchRequest(List.of(), 0, null, Path.of("/out"), InsurerProfile.RELIANCE, 1));

        verify(runRepository).finishRun(eq("run-1"), eq(RunStatus.PAUSED), eq(RunService.PAUSE_REASON), any(), any());
        assertThat(service.runningRunId()).isNull();
    }

    @Test
    void stoppedBatchIsRecordedAsStopped() {
        when(orchestrator.run(any(), any(), any())).thenReturn(batchRun(BatchStatus.STOPPED, 5));

        service.execute("run-1", new BatchRequest(List.of(), 0, null, Path.of("/out"), InsurerProfile.RELIANCE, 1));

        verify(runRepository).finishRun(eq("run-1"), eq(RunStatus.STOPPED), eq(RunService.STOP_REASON), any(), any());
    }

    @Test
    void interruptedBatchIsRecordedAsStoppedAndKeepsTheInterrupt() {
        when(orchestrator.run(any(), any(), any())).thenAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return batchRun(BatchStatus.STOPPED, 5);
        });

        boolean interrupted;
        try {
            service.execute("run-1", new BatchRequest(List.of(), 0, null, Path.of("/out"), InsurerProfile.RELIANCE, 1));
        } finally {
            interrupted = Thread.interrupted();
        }

        assertThat(interrupted).isTrue();
        verify(runRepository).finishRun(eq("run-1"), eq(RunStatus.STOPPED), eq(RunService.STOP_REASON), any(), any());
        verify(runRepository, never()).failRun(anyString(), any());
    }

    @Test
    void unexpectedFailureMarksTheRunFailed() {
        when(orchestrator.run(any(), any(), any())).thenThrow(new IllegalStateException("disk full"));

        service.execute("run-1", new BatchRequest(List.of(), 0, null, Path.of("/out"), InsurerProfile.RELIANCE, 1));

        verify(runRepository).failRun("run-1", "disk full");
        assertThat(service.runningRunId()).isNull();
    }

    @Test
    void resumeStartsFromNextIndexWithRemainingLimit() {
        when(runRepository.findRunById("run-1"))
                .thenReturn(Optional.of(finished("run-1", 5, 10, 7, RunStatus.PAUSED)));
        when(orchestrator.run(any(), any(), any())).thenReturn(batchRun(BatchStatus.COMPLETED, 15));

        service.resumeRun("run-1");

        ArgumentCaptor<RunRecord> record = ArgumentCaptor.forClass(RunRecord.class);
        verify(runRepository).insertRun(record.capture());
        assertThat(record.getValue().startIndex()).isEqualTo(7);
        assertThat(record.getValue().itemLimit()).isEqualTo(8);
        assertThat(record.getValue().outputDir()).isEqualTo(Path.of("/out").toAbsolutePath().normalize().toString());
        assertThat(record.getValue().workers()).isEqualTo(2);
    }

    @Test
    void runningRunCannotBeResumed() {
        when(runRepository.findRunById("run-1"))
                .thenReturn(Optional.of(finished("run-1", 0, null, null, RunStatus.RUNNING)));

        assertThatThrownBy(() -> service.resumeRun("run-1")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void unknownRunIsNotFound() {
        when(runRepository.findRunById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getRun("nope"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> service.stopRun("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
