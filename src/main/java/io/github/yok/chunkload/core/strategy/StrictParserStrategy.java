package io.github.yok.chunkload.core.strategy;

import io.github.yok.chunkload.core.ColumnAlignment;
import io.github.yok.chunkload.core.ColumnAlignment.AlignedColumn;
import io.github.yok.chunkload.db.DbDialectHandler;
import io.github.yok.chunkload.exception.BatchWriteException;
import io.github.yok.chunkload.exception.RowCoercionException;
import io.github.yok.chunkload.exception.SchemaMismatchException;
import io.github.yok.chunkload.exception.SourceIoException;
import io.github.yok.chunkload.util.CsvUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.dataset.datatype.DataTypeException;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.dataset.datatype.TypeCastException;

/**
 * Strategy that parses records with Apache Commons CSV and coerces each value to its column type.
 *
 * <p>
 * Rows with a wrong field count or an unconvertible value are skipped and counted. Rows are
 * written in sub-batches of {@code batchSize}, each committed on success. A sub-batch the
 * destination rejects is rolled back and written again in halves until the offending row is
 * isolated; a single row that still fails ends the attempt with {@link BatchWriteException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class StrictParserStrategy implements ImportStrategy {

    private final DataSource dataSource;

    private final DbDialectHandler dialect;

    private final int batchSize;

    /**
     * Creates the strategy.
     *
     * @param dataSource destination data source
     * @param dialect destination dialect
     * @param batchSize rows per committed sub-batch
     */
    public StrictParserStrategy(DataSource dataSource, DbDialectHandler dialect, int batchSize) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public ImportMethod getMethod() {
        return ImportMethod.STRICT;
    }

    @Override
    public ImportOutcome importChunk(Path chunkFile, String table, ColumnAlignment columns) {
        List<AlignedColumn> aligned = columns.getColumns();
        DataType[] types = resolveTypes(aligned);
        String sql = dialect.buildInsertIgnoreSql(columns.getTable().getName(),
                columns.destinationNames());

        long skipped = 0;
        WriteTally tally = new WriteTally();
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (CSVParser parser = CsvUtils.openParser(chunkFile);
                    PreparedStatement ps = conn.prepareStatement(sql)) {
                Iterator<CSVRecord> it = parser.iterator();
                if (it.hasNext()) {
                    it.next();
                }
                List<Object[]> batch = new ArrayList<>(Math.min(batchSize, 10_000));
                while (it.hasNext()) {
                    CSVRecord record = it.next();
                    if (record.size() != columns.getHeaderSize()) {
                        log.debug("[{}] Record {} has {} fields, header has {}; skipped", table,
                                record.getRecordNumber(), record.size(), columns.getHeaderSize());
                        skipped++;
                        continue;
                    }
                    try {
                        batch.add(coerceRow(record, aligned, types));
                    } catch (RowCoercionException e) {
                        log.debug("[{}] Record {} skipped: {}", table, record.getRecordNumber(),
                                e.getMessage());
                        skipped++;
                        continue;
                    }
                    if (batch.size() >= batchSize) {
                        writeBatch(conn, ps, batch, aligned, types, tally, table);
                        batch.clear();
                    }
                }
                if (!batch.isEmpty()) {
                    writeBatch(conn, ps, batch, aligned, types, tally, table);
                }
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new BatchWriteException("Failed to write chunk " + chunkFile.getFileName()
                    + " into " + table + ": " + e.getMessage(), e);
        } catch (IOException | UncheckedIOException e) {
            throw new SourceIoException("Failed to read chunk " + chunkFile, e);
        }
        skipped += tally.rejected;
        log.debug("[{}] {} rows accepted ({} new), {} skipped ({} rejected by the destination)",
                table, tally.accepted, tally.inserted, skipped, tally.rejected);
        return new ImportOutcome(tally.accepted, skipped);
    }

    private DataType[] resolveTypes(List<AlignedColumn> aligned) {
        IDataTypeFactory factory = dialect.getDataTypeFactory();
        DataType[] types = new DataType[aligned.size()];
        for (int i = 0; i < aligned.size(); i++) {
            AlignedColumn column = aligned.get(i);
            try {
                types[i] = factory.createDataType(column.getDestination().getSqlType(),
                        column.getDestination().getTypeName());
            } catch (DataTypeException e) {
                throw new SchemaMismatchException("Unsupported type "
                        + column.getDestination().getTypeName() + " of column "
                        + column.getDestination().getName(), e);
            }
        }
        return types;
    }

    private Object[] coerceRow(CSVRecord record, List<AlignedColumn> aligned, DataType[] types) {
        Object[] values = new Object[aligned.size()];
        for (int i = 0; i < aligned.size(); i++) {
            AlignedColumn column = aligned.get(i);
            values[i] = ValueCoercer.coerce(record.get(column.getHeaderIndex()),
                    column.getDestination(), types[i]);
        }
        return values;
    }

    /**
     * Writes and commits rows, bisecting on failure. A single row the destination rejects with a
     * data or constraint error (SQLState class 22 or 23) is counted as rejected; any other failure
     * of a single row ends the attempt.
     */
    private void writeBatch(Connection conn, PreparedStatement ps, List<Object[]> rows,
            List<AlignedColumn> aligned, DataType[] types, WriteTally tally, String table)
            throws SQLException {
        try {
            for (Object[] row : rows) {
                bind(ps, row, aligned, types);
                ps.addBatch();
            }
            int[] counts = ps.executeBatch();
            conn.commit();
            tally.accepted += rows.size();
            tally.inserted += countInserted(counts);
        } catch (SQLException e) {
            conn.rollback();
            ps.clearBatch();
            if (rows.size() == 1) {
                if (BulkLoadStrategy.isDataError(e)) {
                    log.debug("[{}] Row rejected by the destination; skipped: {}", table,
                            e.getMessage());
                    tally.rejected++;
                    return;
                }
                throw new BatchWriteException("Row rejected by the destination even when written"
                        + " alone: " + e.getMessage(), e);
            }
            log.debug("[{}] Sub-batch of {} rows rejected, retrying in halves: {}", table,
                    rows.size(), e.getMessage());
            int mid = rows.size() / 2;
            writeBatch(conn, ps, rows.subList(0, mid), aligned, types, tally, table);
            writeBatch(conn, ps, rows.subList(mid, rows.size()), aligned, types, tally, table);
        }
    }

    private void bind(PreparedStatement ps, Object[] row, List<AlignedColumn> aligned,
            DataType[] types) throws SQLException {
        for (int i = 0; i < row.length; i++) {
            if (row[i] == null) {
                ps.setNull(i + 1, aligned.get(i).getDestination().getSqlType());
                continue;
            }
            if (types[i] == DataType.UNKNOWN) {
                ps.setObject(i + 1, row[i]);
                continue;
            }
            try {
                types[i].setSqlValue(row[i], i + 1, ps);
            } catch (TypeCastException e) {
                throw new SQLException("Cannot bind value of column "
                        + aligned.get(i).getDestination().getName(), "22000", e);
            }
        }
    }

    private static long countInserted(int[] counts) {
        long total = 0;
        for (int count : counts) {
            total += count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0);
        }
        return total;
    }

    /**
     * Row counters of one chunk across its sub-batches.
     */
    private static final class WriteTally {

        // Rows committed, conflicts ignored by the insert included
        private long accepted;

        // Rows the driver reported as newly inserted
        private long inserted;

        // Single rows refused with a data or constraint error
        private long rejected;
    }
}
