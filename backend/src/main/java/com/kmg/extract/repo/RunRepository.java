package com.kmg.extract.repo;

import com.kmg.extract.model.InsurerProfile;
import com.kmg.extract.model.RunRecord;
import com.kmg.extract.model.RunStatus;
import com.kmg.extract.model.RunSummary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Repository
public class RunRepository {
    private final JdbcTemplate jdbcTemplate;

    public RunRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<RunRecord> RUN_MAPPER = new RowMapper<>() {
        @Override
        public RunRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new RunRecord(
                    rs.getString("id"),
                    rs.getString("backlog_dir"),
                    InsurerProfile.valueOf(rs.getString("profile")),
                    rs.getInt("start_index"),
                    nullableInt(rs, "item_limit"),
                    rs.getString("output_dir"),
                    rs.getInt("workers"),
                    RunStatus.valueOf(rs.getString("status")),
                    SqlTime.read(rs, "created_at"),
                    SqlTime.read(rs, "started_at"),
                    SqlTime.read(rs, "ended_at"),
                    rs.getString("stop_reason"),
                    rs.getInt("total_items"),
                    rs.getInt("processed_items"),
                    nullableInt(rs, "current_index"),
                    rs.getInt("succeeded"),
                    rs.getInt("failed"),
                    rs.getInt("skipped"),
                    nullableInt(rs, "next_index"),
                    rs.getString("last_error")
            );
        }
    };

    public void ensureSchema() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS runs (
              id TEXT PRIMARY KEY,
              backlog_dir TEXT NOT NULL,
              profile TEXT NOT NULL,
              start_index INTEGER NOT NULL,
              item_limit INTEGER,
              output_dir TEXT NOT NULL,
              workers INTEGER NOT NULL DEFAULT 1,
              status TEXT NOT NULL,
              created_at TEXT NOT NULL,
              started_at TEXT,
              ended_at TEXT,
              stop_reason TEXT,
              total_items INTEGER NOT NULL,
              processed_items INTEGER NOT NULL DEFAULT 0,
              current_index INTEGER,
              succeeded INTEGER NOT NULL DEFAULT 0,
              failed INTEGER NOT NULL DEFAULT 0,
              skipped INTEGER NOT NULL DEFAULT 0,
              next_index INTEGER,
              last_error TEXT
            )
            """);
    }

    public void insertRun(RunRecord record) {
        jdbcTemplate.update(
                """
                INSERT INTO runs(id, backlog_dir, profile, start_index, item_limit, output_dir, workers, status,
                                 created_at, started_at, ended_at, stop_reason, total_items, processed_items,
                                 current_index, succeeded, failed, skipped, next_index, last_error)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                record.id(),
                record.backlogDir(),
                record.profile().name(),
                record.startIndex(),
                record.itemLimit(),
                record.outputDir(),
                record.workers(),
                record.status().name(),
                SqlTime.toText(record.createdAt()),
                SqlTime.toText(record.startedAt()),
                SqlTime.toText(record.endedAt()),
                record.stopReason(),
                record.totalItems(),
                record.processedItems(),
                record.currentIndex(),
                record.succeeded(),
                record.failed(),
                record.skipped(),
                record.nextIndex(),
                record.lastError()
        );
    }

    public Optional<RunRecord> findRunById(String id) {
        List<RunRecord> rows = jdbcTemplate.query("SELECT * FROM runs WHERE id = ?", RUN_MAPPER, id);
        return rows.stream().findFirst();
    }

    public List<RunRecord> findRuns() {
        return jdbcTemplate.query("SELECT * FROM runs ORDER BY created_at DESC", RUN_MAPPER);
    }

    public void updateProgress(String runId, int processedItems, int currentIndex) {
        jdbcTemplate.update(
                "UPDATE runs SET processed_items = ?, current_index = ? WHERE id = ?",
                processedItems,
                currentIndex,
                runId
        );
    }

    public void finishRun(String runId, RunStatus status, String stopReason, String lastError, RunSummary summary) {
        jdbcTemplate.update(
                """
                UPDATE runs
                   SET status = ?,
                       stop_reason = ?,
                       last_error = ?,
                       processed_items = ?,
                       succeeded = ?,
                       failed = ?,
                       skipped = ?,
                       next_index = ?,
                       ended_at = ?
                 WHERE id = ?
                """,
                status.name(),
                stopReason,
                lastError,
                summary.succeeded() + summary.failed() + summary.skipped(),
                summary.succeeded(),
                summary.failed(),
                summary.skipped(),
                summary.nextIndex(),
                SqlTime.nowText(),
                runId
        );
    }

    public void failRun(String runId, String lastError) {
        jdbcTemplate.update(
                """
                UPDATE runs
                   SET status = 'FAILED',
                       stop_reason = 'Run aborted',
                       last_error = ?,
                       ended_at = ?
                 WHERE id = ?
                """,
                lastError,
                SqlTime.nowText(),
                runId
        );
    }

    public int recoverRunningRunsAfterRestart() {
        return jdbcTemplate.update(
                """
                UPDATE runs
                   SET status = 'FAILED',
                       ended_at = COALESCE(ended_at, ?),
                       stop_reason = COALESCE(stop_reason, 'Application restarted'),
                       last_error = COALESCE(last_error, 'Application restarted while run was in progress'),
                       next_index = COALESCE(next_index, start_index)
                 WHERE status = 'RUNNING'
                """,
                SqlTime.nowText()
        );
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
