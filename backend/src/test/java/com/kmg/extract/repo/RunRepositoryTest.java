package com.kmg.extract.repo;

import com.kmg.extract.model.BatchStatus;
import com.kmg.extract.model.InsurerProfile;
import com.kmg.extract.model.RunRecord;
import com.kmg.extract.model.RunStatus;
import com.kmg.extract.model.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RunRepositoryTest {

    @TempDir
    Path dir;

    private RunRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + dir.resolve("runs.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        repository = new RunRepository(new JdbcTemplate(dataSource));
        repository.ensureSchema();
        repository.ensureSchema();
    }

    private RunRecord running(String id, Integer limit) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        return new RunRecord(id, "/backlog", InsurerProfile.SHRIRAM, 5, limit, "/out", 2, RunStatus.RUNNING,
                now, now, null, null, 10, 0, null, 0, 0, 0, null, null);
    }

    @Test
    void insertsAndReadsBack() {
        repository.insertRun(running("run-1", null));

        RunRecord run = repository.findRunById("run-1").orElseThrow();
        assertThat(run.profile()).isEqualTo(InsurerProfile.SHRIRAM);
        assertThat(run.itemLimit()).isNull();
        assertThat(run.currentIndex()).isNull();
        assertThat(run.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(run.endedAt()).isNull();
        assertThat(repository.findRunById("other")).isEmpty();
    }

    @Test
    void timestampsAreStoredInUtcAndListedNewestFirst() {
        OffsetDateTime older = OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.ofHoursMinutes(5, 30));
        OffsetDateTime newer = OffsetDateTime.of(2024, 3, 1, 6, 0, 0, 0, ZoneOffset.UTC);
        repository.insertRun(new RunRecord("run-old", "/backlog", InsurerProfile.RELIANCE, 0, null, "/out", 1,
                RunStatus.COMPLETED, older, older, null, null, 1, 0, null, 0, 0, 0, null, null));
        repository.insertRun(new RunRecord("run-new", "/backlog", InsurerProfile.RELIANCE, 0, null, "/out", 1,
                RunStatus.COMPLETED, newer, newer, null, null, 1, 0, null, 0, 0, 0, null, null));

        RunRecord old = repository.findRunById("run-old").orElseThrow();
        assertThat(old.createdAt().getOffset()).isEqualTo(ZoneOffset.UTC);
        assertThat(old.createdAt().toInstant()).isEqualTo(older.toInstant());
        assertThat(repository.findRuns()).extracting(RunRecord::id).containsExactly("run-new", "run-old");
    }

    @Test
    void tracksProgressAndFinish() {
        repository.insertRun(running("run-1", 10));
        repository.updateProgress("run-1", 3, 7);

        RunRecord inProgress = repository.findRunById("run-1").orElseThrow();
        assertThat(inProgress.processedItems()).isEqualTo(3);
        assertThat(inProgress.currentIndex()).isEqualTo(7);

        RunSummary summary = new RunSummary(BatchStatus.PAUSED, 5, 10, 10, 3, 1, 1, 2, 3, 12, 10L, "s", "e");
        repository.finishRun("run-1", RunStatus.PAUSED, "No usable credential", "No usable credential", summary);

        RunRecord finished = repository.findRunById("run-1").orElseThrow();
        assertThat(finished.status()).isEqualTo(RunStatus.PAUSED);
        assertThat(finished.succeeded()).isEqualTo(3);
        assertThat(finished.failed()).isEqualTo(2);
        assertThat(finished.skipped()).isEqualTo(2);
        assertThat(finished.processedItems()).isEqualTo(7);
        assertThat(finished.nextIndex()).isEqualTo(12);
        assertThat(finished.endedAt()).isNotNull();
    }

    @Test
    void restartMarksRunningRunsFailed() {
        repository.insertRun(running("run-1", null));
        repository.insertRun(running("run-2", null));
        repository.failRun("run-2", "boom");

        assertThat(repository.recoverRunningRunsAfterRestart()).isEqualTo(1);

        RunRecord recovered = repository.findRunById("run-1").orElseThrow();
        assertThat(recovered.status()).isEqualTo(RunStatus.FAILED);
        assertThat(recovered.stopReason()).isEqualTo("Application restarted");
        assertThat(recovered.nextIndex()).isEqualTo(5);
        assertThat(repository.findRunById("run-2").orElseThrow().lastError()).isEqualTo("boom");
        assertThat(repository.findRuns()).hasSize(2);
    }
}
