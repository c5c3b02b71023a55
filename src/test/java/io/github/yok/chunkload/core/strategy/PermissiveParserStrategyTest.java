package io.github.yok.chunkload.core.strategy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.chunkload.H2TestDatabase;
import io.github.yok.chunkload.core.ColumnAligner;
import io.github.yok.chunkload.core.ColumnAlignment;
import io.github.yok.chunkload.db.h2.H2DialectHandler;
import io.github.yok.chunkload.util.CsvUtils;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

class PermissiveParserStrategyTest {

    private static final String HEADER = "id,name,active,born,updated_at";

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private JdbcTemplate jdbc;
    private H2DialectHandler dialect;

    @BeforeEach
    void setUp() {
        dataSource = H2TestDatabase.create();
        jdbc = H2TestDatabase.createPeopleTable(dataSource);
        dialect = new H2DialectHandler();
    }

    private ColumnAlignment align(Path chunk) throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            return new ColumnAligner().align(CsvUtils.readHeader(chunk),
                    dialect.readTable(conn, "people"));
        }
    }

    private List<Integer> ids() {
        return jdbc.queryForList("SELECT id FROM people ORDER BY id", Integer.class);
    }

    @Test
    void getMethod_正常ケース_取得する_PERMISSIVEが返されること() {
        assertEquals(ImportMethod.PERMISSIVE,
                new PermissiveParserStrategy(dataSource, dialect, 2, 10).getMethod());
    }

    @Test
    void importChunk_正常ケース_引用符内の改行を含む_1レコードとして登録されること() throws Exception {
        Path chunk = H2TestDatabase.writeCsv(tempDir.resolve("c1.csv"), HEADER,
                "1,\"multi", "line\",true,2000-01-01,2024-05-01 10:00:00", "2,b,false,,");
        PermissiveParserStrategy strategy = new PermissiveParserStrategy(dataSource, dialect, 2,
                10);

        ImportOutcome outcome = strategy.importChunk(chunk, "people", align(chunk));

        assertEquals(2L, outcome.getRowsImported());
        assertEquals(0L, outcome.getRowsSkipped());
        assertEquals("multi\nline",
                jdbc.queryForObject("SELECT name FROM people WHERE id = 1", String.class));
        assertEquals(Boolean.FALSE,
                jdbc.queryForObject("SELECT active FROM people WHERE id = 2", Boolean.class));
    }

    @Test
    void importChunk_正常ケース_閉じない引用符を含む_上限行数で打ち切り残りを登録すること()
            throws Exception {
        Path chunk = H2TestDatabase.writeCsv(tempDir.resolve("c1.csv"), HEADER, "1,a,true,,",
                "2,b,true,,", "3,\"broken,true,,", "4,d,true,,", "5,e,true,,");
        PermissiveParserStrategy strategy = new PermissiveParserStrategy(dataSource, dialect, 10,
                2);

        ImportOutcome outcome = strategy.importChunk(chunk, "people", align(chunk));

        assertEquals(3L, outcome.getRowsImported());
        assertEquals(1L, outcome.getRowsSkipped());
        assertEquals(List.of(1, 2, 5), ids());
    }

    @Test
    void importChunk_正常ケース_列数が異なる行を含む_その行が除外されること() throws Exception {
        Path chunk = H2TestDatabase.writeCsv(tempDir.resolve("c1.csv"), HEADER, "1,a,true,,",
                "2,b", "3,c,true,,,x", "4,d,true,,");
        PermissiveParserStrategy strategy = new PermissiveParserStrategy(dataSource, dialect, 10,
                10);

        ImportOutcome outcome = strategy.importChunk(chunk, "people", align(chunk));

        assertEquals(2L, outcome.getRowsImported());
        assertEquals(2L, outcome.getRowsSkipped());
        assertEquals(List.of(1, 4), ids());
    }

    @Test
    void importChunk_正常ケース_拒否される行を含むバッチがある_そのバッチだけ除外されること()
            throws Exception {
        Path chunk = H2TestDatabase.writeCsv(tempDir.resolve("c1.csv"), HEADER, "1,a,true,,",
                "2,b,true,,", "3,,true,,", "4,d,true,,", "5,e,true,,");
        PermissiveParserStrategy strategy = new PermissiveParserStrategy(dataSource, dialect, 2,
                10);

        ImportOutcome outcome = strategy.importChunk(chunk, "people", align(chunk));

        assertEquals(3L, outcome.getRowsImported());
        assertEquals(2L, outcome.getRowsSkipped());
        assertEquals(List.of(1, 2, 5), ids());
    }

    @Test
    void importChunk_正常ケース_不正なUTF8バイトを含む_置換文字に置き換えて登録されること()
            throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write((HEADER + "\n1,ab").getBytes(StandardCharsets.UTF_8));
        out.write(0xC3);
        out.write(0x28);
        out.write(",true,,\n".getBytes(StandardCharsets.UTF_8));
        Path chunk = Files.write(tempDir.resolve("c1.csv"), out.toByteArray());
        PermissiveParserStrategy strategy = new PermissiveParserStrategy(dataSource, dialect, 2,
                10);

        ImportOutcome outcome = strategy.importChunk(chunk, "people", align(chunk));

        assertEquals(1L, outcome.getRowsImported());
        String name = jdbc.queryForObject("SELECT name FROM people WHERE id = 1", String.class);
        assertTrue(name.startsWith("ab"));
        assertTrue(name.contains("\uFFFD"));
    }
}
