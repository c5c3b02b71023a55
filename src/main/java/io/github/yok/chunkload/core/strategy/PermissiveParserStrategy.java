package io.github.yok.chunkload.core.strategy;

import io.github.yok.chunkload.core.ColumnAlignment;
import io.github.yok.chunkload.core.ColumnAlignment.AlignedColumn;
import io.github.yok.chunkload.db.DbDialectHandler;
import io.github.yok.chunkload.exception.BatchWriteException;
import io.github.yok.chunkload.exception.SourceIoException;
import io.github.yok.chunkload.util.CsvUtils;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * Strategy that tolerates damaged input at the cost of throughput.
 *
 * <p>
 * The chunk is read line by line; physical lines are joined while a quoted field is still open,
 * up to {@code maxRecordLines} lines, and each logical record is parsed on its own so that one
 * malformed record never affects its neighbours. Values are bound as text and converted by the
 * database. A sub-batch the destination rejects is rolled back and its rows are counted as
 * skipped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PermissiveParserStrategy implements ImportStrategy {

    private final DataSource dataSource;

    private final DbDialectHandler dialect;

    private final int batchSize;

    private final int maxRecordLines;

    /**
     * Creates the strategy.
     *
     * @param dataSource destination data source
     * @param dialect destination dialect
     * @param batchSize rows per committed sub-batch
     * @param maxRecordLines maximum physical lines joined into one record
     */
    public PermissiveParserStrategy(DataSource dataSource, DbDialectHandler dialect,
            int batchSize, int maxRecordLines) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.batchSize = Math.max(1, batchSize);
        this.maxRecordLines = Math.max(1, maxRecordLines);
    }

    @Override
    public ImportMethod getMethod() {
        return ImportMethod.PERMISSIVE;
    }

    @Override
    public ImportOutcome importChunk(Path chunkFile, String table, ColumnAlignment columns) {
        List<AlignedColumn> aligned = columns.getColumns();
        String sql = dialect.buildInsertIgnoreSql(columns.getTable().getName(),
                columns.destinationNames());

        Counters counters = new Counters();
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (BufferedReader reader = new BufferedReader(CsvUtils.openLenientReader(chunkFile));
                    PreparedStatement ps = conn.prepareStatement(sql)) {
                List<String[]> batch = new ArrayList<>(Math.min(batchSize, 10_000));
                boolean headerSeen = false;
                String text;
                while ((text = nextLogicalRecord(reader, counters)) != null) {
                    if (!headerSeen) {
                        headerSeen = true;
                        continue;
                    }
                    List<String> fields = parse(text);
                    if (fields == null || fields.size() != columns.getHeaderSize()) {
                        counters.skipped++;
                        continue;
                    }
                    String[] row = new String[aligned.size()];
                    for (int i = 0; i < aligned.size(); i++) {
                        String raw = fields.get(aligned.get(i).getHeaderIndex());
                        row[i] = ValueCoercer.isNullToken(raw) ? null : raw;
                    }
                    batch.add(row);
                    if (batch.size() >= batchSize) {
                        writeBatch(conn, ps, batch, aligned, table, counters);
                        batch.clear();
                    }
                }
                if (!batch.isEmpty()) {
                    writeBatch(conn, ps, batch, aligned, table, counters);
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
        return new ImportOutcome(counters.imported, counters.skipped);
    }

    /**
     * Reads physical lines until the quotes of the collected text are balanced. Records whose
     * quoted field never closes within {@code maxRecordLines} lines are counted as skipped.
     *
     * @return the logical record, or {@code null} at end of input
     */
    private String nextLogicalRecord(BufferedReader reader, Counters counters)
            throws IOException {
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            if (line.isEmpty()) {
                continue;
            }
            StringBuilder text = new StringBuilder(line);
            int lines = 1;
            boolean complete = true;
            while (StringUtils.countMatches(text, '"') % 2 != 0) {
                String next = lines >= maxRecordLines ? null : reader.readLine();
                if (next == null) {
                    complete = false;
                    break;
                }
                text.append('\n').append(next);
                lines++;
            }
            if (complete) {
                return text.toString();
            }
            log.debug("Unterminated quoted field spanning {} lines dropped", lines);
            counters.skipped++;
        }
    }

    private List<String> parse(String text) {
        try (CSVParser parser = CSVParser.parse(text, CsvUtils.READ_FORMAT)) {
            List<CSVRecord> records = parser.getRecords();
            if (records.size() != 1) {
                return null;
            }
            return CsvUtils.toList(records.get(0));
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            log.debug("Malformed record skipped: {}", e.getMessage());
            return null;
        }
    }

    private void writeBatch(Connection conn, PreparedStatement ps, List<String[]> rows,
            List<AlignedColumn> aligned, String table, Counters counters) throws SQLException {
        try {
            for (String[] row : rows) {
                for (int i = 0; i < row.length; i++) {
                    dialect.bindText(ps, i + 1, row[i],
                            aligned.get(i).getDestination().getSqlType());
                }
                ps.addBatch();
            }
            ps.executeBatch();
            conn.commit();
            counters.imported += rows.size();
        } catch (SQLException e) {
            conn.rollback();
            ps.clearBatch();
            counters.skipped += rows.size();
            log.warn("[{}] Sub-batch of {} rows rejected and skipped: {}", table, rows.size(),
                    e.getMessage());
        }
    }

    private static final class Counters {
        long imported;
        long skipped;
    }
}
