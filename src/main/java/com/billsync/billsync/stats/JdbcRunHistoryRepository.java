package com.billsync.billsync.stats;

import com.billsync.billsync.sync.SyncConstants;
import jakarta.annotation.PostConstruct;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public class JdbcRunHistoryRepository implements RunHistoryRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcRunHistoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + SyncConstants.TABLE_SYNC_RUN + " ("
                + "run_id BIGINT NOT NULL, "
                + "target_table VARCHAR(64) NOT NULL, "
                + "source_name TEXT, "
                + "started_at TIMESTAMP NOT NULL, "
                + "finished_at TIMESTAMP NOT NULL, "
                + "synced_count INT NOT NULL, "
                + "pending_count INT NOT NULL, "
                + "rejected_count INT NOT NULL, "
                + "write_failure_count INT NOT NULL, "
                + "issued_count INT NOT NULL, "
                + "listed_count INT NOT NULL, "
                + "batches_committed INT NOT NULL, "
                + "batches_failed INT NOT NULL, "
                + "unprocessed_count INT NOT NULL, "
                + "aborted BOOLEAN NOT NULL, "
                + "abort_reason TEXT, "
                + "PRIMARY KEY (run_id, target_table)"
                + ")");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_sync_run_started_at ON "
                + SyncConstants.TABLE_SYNC_RUN + "(started_at DESC)");
    }

    @Override
    public void record(RunStatistics statistics) {
        jdbcTemplate.update("INSERT INTO " + SyncConstants.TABLE_SYNC_RUN
                        + " (run_id, target_table, source_name, started_at, finished_at, synced_count, pending_count, "
                        + "rejected_count, write_failure_count, issued_count, listed_count, batches_committed, "
                        + "batches_failed, unprocessed_count, aborted, abort_reason) "
                        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                statistics.runId(),
                statistics.table(),
                statistics.source(),
                Timestamp.valueOf(statistics.startedAt()),
                Timestamp.valueOf(statistics.finishedAt()),
                statistics.synced(),
                statistics.pending(),
                statistics.rejected(),
                statistics.writeFailures(),
                statistics.issued(),
                statistics.listed(),
                statistics.batchesCommitted(),
                statistics.batchesFailed(),
                statistics.unprocessed(),
                statistics.aborted(),
                statistics.abortReason());
    }

    @Override
    public List<RunStatistics> recentRuns(int limit) {
        int safeLimit = Math.max(1, Math.min(limit, 200));
        return jdbcTemplate.query(
                """
                SELECT run_id, target_table, source_name, started_at, finished_at, synced_count, pending_count,
                       rejected_count, write_failure_count, issued_count, listed_count, batches_committed,
                       batches_failed, unprocessed_count, aborted, abort_reason
                FROM sync_run
                ORDER BY run_id DESC, target_table
                LIMIT ?
                """,
                (rs, rowNum) -> mapRun(rs),
                safeLimit
        );
    }

    private static RunStatistics mapRun(ResultSet rs) throws SQLException {
        return new RunStatistics(
                rs.getLong("run_id"),
                rs.getString("target_table"),
                rs.getString("source_name"),
                toLocalDateTime(rs.getTimestamp("started_at")),
                toLocalDateTime(rs.getTimestamp("finished_at")),
                rs.getInt("synced_count"),
                rs.getInt("pending_count"),
                rs.getInt("rejected_count"),
                rs.getInt("write_failure_count"),
                rs.getInt("issued_count"),
                rs.getInt("listed_count"),
                rs.getInt("batches_committed"),
                rs.getInt("batches_failed"),
                rs.getInt("unprocessed_count"),
                rs.getBoolean("aborted"),
                rs.getString("abort_reason")
        );
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toLocalDateTime();
    }
}
