package io.github.yok.chunkload.ledger;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link ChunkLedger} backed by the {@code csv_chunk_progress} table through Spring
 * {@link JdbcTemplate}.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Repository
public class JdbcChunkLedger implements ChunkLedger {

    private static final String COLUMNS = "id, table_name, dataset_date, chunk_number,"
            + " chunk_filename, chunk_start_row, chunk_end_row, chunk_row_count, status,"
            + " rows_imported, rows_skipped, started_at, completed_at, duration_ms,"
            + " error_message, retry_count, import_method, owner_id, created_at, updated_at";

    private static final RowMapper<ChunkRecord> ROW_MAPPER = (rs, n) -> {
        ChunkRecord r = new ChunkRecord();
        r.setId(rs.getLong("id"));
        r.setTableName(rs.getString("table_name"));
        r.setDatasetDate(rs.getString("dataset_date"));
        r.setChunkNumber(rs.getInt("chunk_number"));
        r.setChunkFilename(rs.getString("chunk_filename"));
        r.setChunkStartRow(rs.getLong("chunk_start_row"));
        r.setChunkEndRow(rs.getLong("chunk_end_row"));
        r.setChunkRowCount(rs.getLong("chunk_row_count"));
        r.setStatus(ChunkStatus.fromValue(rs.getString("status")));
        r.setRowsImported(rs.getLong("rows_imported"));
        r.setRowsSkipped(rs.getLong("rows_skipped"));
        r.setStartedAt(toInstant(rs, "started_at"));
        r.setCompletedAt(toInstant(rs, "completed_at"));
        long duration = rs.getLong("duration_ms");
        r.setDurationMs(rs.wasNull() ? null : duration);
        r.setErrorMessage(rs.getString("error_message"));
        r.setRetryCount(rs.getInt("retry_count"));
        r.setImportMethod(rs.getString("import_method"));
        r.setOwnerId(rs.getString("owner_id"));
        r.setCreatedAt(toInstant(rs, "created_at"));
        r.setUpdatedAt(toInstant(rs, "updated_at"));
        return r;
    };

    private final JdbcTemplate jdbc;

    // Groups the statements of replaceAll; every other mutation is a single statement
    private final TransactionTemplate transactions;

    /**
     * Creates a ledger on the data source of the given template.
     *
     * @param jdbc template bound to the ledger database
     */
    public JdbcChunkLedger(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.transactions =
                new TransactionTemplate(new DataSourceTransactionManager(jdbc.getDataSource()));
    }

    @Override
    public void insertAll(List<ChunkRecord> records, Instant now) {
        if (records.isEmpty()) {
            return;
        }
        Timestamp created = Timestamp.from(now);
        jdbc.batchUpdate("INSERT INTO csv_chunk_progress"
                + " (table_name, dataset_date, chunk_number, chunk_filename, chunk_start_row,"
                + " chunk_end_row, chunk_row_count, status, rows_imported, rows_skipped,"
                + " retry_count, created_at, updated_at)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, 0, 0, ?, ?)", records, records.size(),
                (ps, r) -> {
                    ps.setString(1, r.getTableName());
                    ps.setString(2, r.getDatasetDate());
                    ps.setInt(3, r.getChunkNumber());
                    ps.setString(4, r.getChunkFilename());
                    ps.setLong(5, r.getChunkStartRow());
                    ps.setLong(6, r.getChunkEndRow());
                    ps.setLong(7, r.getChunkRowCount());
                    ps.setString(8, ChunkStatus.PENDING.getValue());
                    ps.setTimestamp(9, created);
                    ps.setTimestamp(10, created);
                });
        log.debug("Inserted {} ledger rows for {}-{}", records.size(),
                records.get(0).getTableName(), records.get(0).getDatasetDate());
    }

    @Override
    public List<ChunkRecord> findByTableAndDate(String table, String date) {
        return jdbc.query("SELECT " + COLUMNS + " FROM csv_chunk_progress"
                + " WHERE table_name = ? AND dataset_date = ? ORDER BY chunk_number", ROW_MAPPER,
                table, date);
    }

    @Override
    public Optional<ChunkRecord> find(String table, String date, int chunkNumber) {
        List<ChunkRecord> rows = jdbc.query("SELECT " + COLUMNS + " FROM csv_chunk_progress"
                + " WHERE table_name = ? AND dataset_date = ? AND chunk_number = ?", ROW_MAPPER,
                table, date, chunkNumber);
        return rows.stream().findFirst();
    }

    @Override
    public void markProcessing(String table, String date, int chunkNumber, String ownerId,
            String method, int retryCount, Instant startedAt) {
        Timestamp ts = Timestamp.from(startedAt);
        jdbc.update("UPDATE csv_chunk_progress SET status = ?, owner_id = ?, import_method = ?,"
                + " retry_count = ?, started_at = ?, completed_at = NULL, updated_at = ?"
                + " WHERE table_name = ? AND dataset_date = ? AND chunk_number = ?",
                ChunkStatus.PROCESSING.getValue(), ownerId, method, retryCount, ts, ts, table,
                date, chunkNumber);
    }

    @Override
    public void markCompleted(String table, String date, int chunkNumber, String method,
            long rowsImported, long rowsSkipped, Instant completedAt, long durationMs) {
        Timestamp ts = Timestamp.from(completedAt);
        jdbc.update("UPDATE csv_chunk_progress SET status = ?, import_method = ?,"
                + " rows_imported = ?, rows_skipped = ?, completed_at = ?, duration_ms = ?,"
                + " error_message = NULL, updated_at = ?"
                + " WHERE table_name = ? AND dataset_date = ? AND chunk_number = ?",
                ChunkStatus.COMPLETED.getValue(), method, rowsImported, rowsSkipped, ts,
                durationMs, ts, table, date, chunkNumber);
    }

    @Override
    public void markFailed(String table, String date, int chunkNumber, String errorMessage,
            Instant completedAt, long durationMs) {
        Timestamp ts = Timestamp.from(completedAt);
        jdbc.update("UPDATE csv_chunk_progress SET status = ?, error_message = ?,"
                + " completed_at = ?, duration_ms = ?, updated_at = ?"
                + " WHERE table_name = ? AND dataset_date = ? AND chunk_number = ?",
                ChunkStatus.FAILED.getValue(), errorMessage, ts, durationMs, ts, table, date,
                chunkNumber);
    }

    @Override
    public boolean markSkipped(String table, String date, int chunkNumber, Instant now) {
        int updated = jdbc.update("UPDATE csv_chunk_progress SET status = ?, updated_at = ?"
                + " WHERE table_name = ? AND dataset_date = ? AND chunk_number = ?"
                + " AND status IN (?, ?)", ChunkStatus.SKIPPED.getValue(), Timestamp.from(now),
                table, date, chunkNumber, ChunkStatus.PENDING.getValue(),
                ChunkStatus.FAILED.getValue());
        return updated > 0;
    }

    @Override
    public boolean requeue(String table, String date, int chunkNumber, String reason,
            Instant now) {
        int updated = jdbc.update("UPDATE csv_chunk_progress SET status = ?, error_message = ?,"
                + " owner_id = NULL, updated_at = ?"
                + " WHERE table_name = ? AND dataset_date = ? AND chunk_number = ?"
                + " AND status = ?", ChunkStatus.PENDING.getValue(), reason, Timestamp.from(now),
                table, date, chunkNumber, ChunkStatus.PROCESSING.getValue());
        return updated > 0;
    }

    @Override
    public int resetAll(String table, String date, Instant now) {
        return jdbc.update("UPDATE csv_chunk_progress SET status = ?, rows_imported = 0,"
                + " rows_skipped = 0, started_at = NULL, completed_at = NULL,"
                + " duration_ms = NULL, error_message = NULL, retry_count = 0,"
                + " import_method = NULL, owner_id = NULL, updated_at = ?"
                + " WHERE table_name = ? AND dataset_date = ?", ChunkStatus.PENDING.getValue(),
                Timestamp.from(now), table, date);
    }

    @Override
    public int deleteAll(String table, String date) {
        return jdbc.update(
                "DELETE FROM csv_chunk_progress WHERE table_name = ? AND dataset_date = ?",
                table, date);
    }

    @Override
    public int replaceAll(String table, String date, List<ChunkRecord> records, Instant now) {
        Integer deleted = transactions.execute(status -> {
            int count = deleteAll(table, date);
            insertAll(records, now);
            return count;
        });
        log.debug("[{}-{}] Ledger plan replaced: {} records removed, {} inserted", table, date,
                deleted, records.size());
        return deleted == null ? 0 : deleted;
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
