package io.github.yok.chunkload.core.strategy;

import io.github.yok.chunkload.core.ColumnAlignment;
import io.github.yok.chunkload.db.DbDialectHandler;
import io.github.yok.chunkload.exception.BatchWriteException;
import io.github.yok.chunkload.exception.SourceIoException;
import io.github.yok.chunkload.exception.StrategyIncompatibilityException;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Strategy that hands the chunk file to the destination's native bulk-load protocol.
 *
 * <p>
 * The protocol loads the file as is, so the chunk header must name exactly the destination
 * columns. The whole chunk is loaded in one transaction.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BulkLoadStrategy implements ImportStrategy {

    private final DataSource dataSource;

    private final DbDialectHandler dialect;

    /**
     * Creates the strategy.
     *
     * @param dataSource destination data source
     * @param dialect destination dialect
     */
    public BulkLoadStrategy(DataSource dataSource, DbDialectHandler dialect) {
        this.dataSource = dataSource;
        this.dialect = dialect;
    }

    @Override
    public ImportMethod getMethod() {
        return ImportMethod.BULK;
    }

    @Override
    public ImportOutcome importChunk(Path chunkFile, String table, ColumnAlignment columns) {
        if (!columns.isExact()) {
            throw new StrategyIncompatibilityException("Bulk load needs the chunk header to"
                    + " match table " + columns.getTable().getName() + " exactly (dropped="
                    + columns.getDroppedColumns() + ", unfilled=" + columns.getUnfilledColumns()
                    + ")");
        }

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                long rows = dialect.bulkLoad(conn, chunkFile, columns.getTable(),
                        columns.destinationNames());
                conn.commit();
                log.debug("[{}] Bulk load accepted {} rows from {}", table, rows,
                        chunkFile.getFileName());
                return new ImportOutcome(rows, 0);
            } catch (SQLException | IOException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            if (isDataError(e)) {
                throw new StrategyIncompatibilityException("Bulk load rejected the data of "
                        + chunkFile.getFileName() + ": " + e.getMessage(), e);
            }
            throw new BatchWriteException("Bulk load of " + chunkFile.getFileName()
                    + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SourceIoException("Failed to read chunk " + chunkFile, e);
        }
    }

    /**
     * Returns whether the SQLSTATE belongs to class 22 (data exception) or 23 (integrity
     * constraint violation).
     */
    static boolean isDataError(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException) {
                SQLException sql = (SQLException) t;
                // batch failures carry the statement error as the next exception
                if (isDataState(sql.getSQLState()) || (sql.getNextException() != null
                        && isDataState(sql.getNextException().getSQLState()))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isDataState(String state) {
        return state != null && (state.startsWith("22") || state.startsWith("23"));
    }
}
