package io.github.yok.chunkload.core.strategy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.chunkload.H2TestDatabase;
import io.github.yok.chunkload.core.ColumnAligner;
import io.github.yok.chunkload.core.ColumnAlignment;
import io.github.yok.chunkload.db.DbDialectHandler;
import io.github.yok.chunkload.db.TableColumn;
import io.github.yok.chunkload.db.TableDefinition;
import io.github.yok.chunkload.db.h2.H2DialectHandler;
import io.github.yok.chunkload.exception.BatchWriteException;
import io.github.yok.chunkload.exception.SourceIoException;
import io.github.yok.chunkload.exception.StrategyIncompatibilityException;
import io.github.yok.chunkload.util.CsvUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.BatchUpdateException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

class BulkLoadStrategyTest {

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private Connection connection;
    private DbDialectHandler dialect;
    private BulkLoadStrategy strategy;

    private static final TableDefinition ITEMS = new TableDefinition("items",
            List.of(new TableColumn("id", Types.INTEGER, "int4", true),
                    new TableColumn("label", Types.VARCHAR, "varchar", false)));

    @BeforeEach
    void setUp() throws Exception {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        dialect = mock(DbDialectHandler.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getAutoCommit()).thenReturn(true);
        strategy = new BulkLoadStrategy(dataSource, dialect);
    }

    private static ColumnAlignment exact() {
        return new ColumnAligner().align(List.of("id", "label"), ITEMS);
    }

    @Test
    void getMethod_正常ケース_取得する_BULKが返されること() {
        assertEquals(ImportMethod.BULK, strategy.getMethod());
    }

    @Test
    void importChunk_正常ケース_ヘッダが完全一致する_コミットされ件数が返されること() throws Exception {
        Path chunk = tempDir.resolve("c1.csv");
        when(dialect.bulkLoad(connection, chunk, ITEMS, List.of("id", "label")))
                .thenReturn(7L);

        ImportOutcome outcome = strategy.importChunk(chunk, "items", exact());

        assertEquals(7L, outcome.getRowsImported());
        assertEquals(0L, outcome.getRowsSkipped());
        verify(connection).setAutoCommit(false);
        verify(connection).commit();
        verify(connection).setAutoCommit(true);
        verify(connection, never()).rollback();
    }

    @Test
    void importChunk_異常ケース_ヘッダに余分な列がある_StrategyIncompatibilityExceptionが送出され接続しないこと()
            throws Exception {
        ColumnAlignment alignment =
                new ColumnAligner().align(List.of("id", "label", "extra"), ITEMS);

        StrategyIncompatibilityException ex = assertThrows(
                StrategyIncompatibilityException.class,
                () -> strategy.importChunk(tempDir.resolve("c1.csv"), "items", alignment));
        assertTrue(ex.getMessage().contains("extra"));
        assertFalse(ex.isRetryable());
        verify(dataSource, never()).getConnection();
    }

    @Test
    void importChunk_異常ケース_ヘッダに列が不足する_StrategyIncompatibilityExceptionが送出されること() {
        ColumnAlignment alignment = new ColumnAligner().align(List.of("id"), ITEMS);
        assertThrows(StrategyIncompatibilityException.class,
                () -> strategy.importChunk(tempDir.resolve("c1.csv"), "items", alignment));
    }

    @Test
    void importChunk_異常ケース_データ例外SQLStateが返る_StrategyIncompatibilityExceptionに変換されロールバックされること()
            throws Exception {
        SQLException dataError = new SQLException("invalid input syntax", "22P02");
        when(dialect.bulkLoad(any(), any(), any(), anyList())).thenThrow(dataError);

        StrategyIncompatibilityException ex =
                assertThrows(StrategyIncompatibilityException.class,
                        () -> strategy.importChunk(tempDir.resolve("c1.csv"), "items", exact()));
        assertSame(dataError, ex.getCause());
        verify(connection).rollback();
        verify(connection, never()).commit();
    }

    @Test
    void importChunk_異常ケース_接続系SQLStateが返る_BatchWriteExceptionに変換されること()
            throws Exception {
        when(dialect.bulkLoad(any(), any(), any(), anyList()))
                .thenThrow(new SQLException("connection lost", "08006"));

        BatchWriteException ex = assertThrows(BatchWriteException.class,
                () -> strategy.importChunk(tempDir.resolve("c1.csv"), "items", exact()));
        assertTrue(ex.isRetryable());
        verify(connection).rollback();
    }

    @Test
    void importChunk_異常ケース_ファイル読込に失敗する_SourceIoExceptionに変換されること()
            throws Exception {
        when(dialect.bulkLoad(any(), any(), any(), anyList()))
                .thenThrow(new IOException("disk gone"));

        assertThrows(SourceIoException.class,
                () -> strategy.importChunk(tempDir.resolve("c1.csv"), "items", exact()));
        verify(connection).rollback();
    }

    @Test
    void isDataError_正常ケース_原因連鎖に制約違反を含む_trueが返されること() {
        BatchUpdateException outer = new BatchUpdateException("batch", "XX000", new int[0]);
        outer.initCause(new SQLException("duplicate key", "23505"));

        assertTrue(BulkLoadStrategy.isDataError(outer));
        assertFalse(BulkLoadStrategy.isDataError(new SQLException("timeout", "57014")));
        assertFalse(BulkLoadStrategy.isDataError(new SQLException("no state")));
    }

    @Test
    void isDataError_正常ケース_次の例外にデータ例外を持つバッチ例外_trueが返されること() {
        BatchUpdateException batch = new BatchUpdateException("batch", "XX000", new int[0]);
        batch.setNextException(new SQLException("value too long", "22001"));

        assertTrue(BulkLoadStrategy.isDataError(batch));
    }

    @Test
    void importChunk_正常ケース_H2へCSVREADで取り込む_全行が登録され再取込でも重複しないこと()
            throws Exception {
        DataSource h2 = H2TestDatabase.create();
        JdbcTemplate jdbc = H2TestDatabase.createPeopleTable(h2);
        H2DialectHandler h2Dialect = new H2DialectHandler();
        Path chunk = H2TestDatabase.writeCsv(tempDir.resolve("people.chunk_0001.csv"),
                "ID,Name,active,born,updated_at",
                "1,alice,true,2000-01-01,2024-05-01 10:00:00",
                "2,bob,false,2000-01-02,2024-05-01 11:00:00",
                "3,\"carol, jr\",true,2000-01-03,2024-05-01 12:00:00");
        ColumnAlignment alignment;
        try (Connection conn = h2.getConnection()) {
            alignment = new ColumnAligner().align(CsvUtils.readHeader(chunk),
                    h2Dialect.readTable(conn, "people"));
        }
        BulkLoadStrategy h2Strategy = new BulkLoadStrategy(h2, h2Dialect);

        ImportOutcome outcome = h2Strategy.importChunk(chunk, "people", alignment);
        h2Strategy.importChunk(chunk, "people", alignment);

        assertEquals(3L, outcome.getRowsImported());
        assertEquals(3, jdbc.queryForObject("SELECT COUNT(*) FROM people", Integer.class));
        assertEquals("carol, jr",
                jdbc.queryForObject("SELECT name FROM people WHERE id = 3", String.class));
    }
}
