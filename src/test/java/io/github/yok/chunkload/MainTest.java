package io.github.yok.chunkload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import io.github.yok.chunkload.config.ChunkLoadConfig;
import io.github.yok.chunkload.config.PathsConfig;
import io.github.yok.chunkload.config.RechunkPolicy;
import io.github.yok.chunkload.core.ChunkSplitter;
import io.github.yok.chunkload.core.ImportCoordinator;
import io.github.yok.chunkload.core.ImportRequest;
import io.github.yok.chunkload.core.ImportRunSummary;
import io.github.yok.chunkload.core.OverallStatus;
import io.github.yok.chunkload.core.ProgressQuery;
import io.github.yok.chunkload.core.ProgressSummary;
import io.github.yok.chunkload.core.strategy.ImportMethod;
import io.github.yok.chunkload.ledger.ChunkStatus;
import io.github.yok.chunkload.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private PathsConfig pathsConfig;
    private ChunkLoadConfig chunkLoadConfig;
    private ChunkSplitter splitter;
    private ImportCoordinator coordinator;
    private ProgressQuery progressQuery;

    private Main main;

    @BeforeEach
    void setup() {
        pathsConfig = mock(PathsConfig.class);
        chunkLoadConfig = new ChunkLoadConfig();
        splitter = mock(ChunkSplitter.class);
        coordinator = mock(ImportCoordinator.class);
        progressQuery = mock(ProgressQuery.class);
        main = new Main(pathsConfig, chunkLoadConfig, splitter, coordinator, progressQuery);
    }

    private static ImportRunSummary summary(int failed) {
        return ImportRunSummary.builder().table("people").date("d1").method(ImportMethod.STRICT)
                .totalChunks(3).statusCounts(Map.of()).processedChunks(3)
                .successfulChunks(3 - failed).failedChunks(failed).elapsed(Duration.ZERO)
                .errors(List.of()).build();
    }

    private static ProgressSummary progress() {
        Map<ChunkStatus, Integer> counts = new EnumMap<>(ChunkStatus.class);
        counts.put(ChunkStatus.COMPLETED, 1);
        counts.put(ChunkStatus.PENDING, 1);
        return ProgressSummary.builder().table("people").date("d1").totalChunks(2)
                .statusCounts(counts).plannedRows(8).rowsImported(4).expectedTotal(8)
                .percentComplete(50.0).chunkPercent(50.0).overallStatus(OverallStatus.IN_PROGRESS)
                .build();
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(null);

                    Object arg0 = ctx.arguments().get(0);
                    assertTrue(arg0 instanceof Class<?>[]);
                    Class<?>[] sources = (Class<?>[]) arg0;
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"progress", "--table", "people", "--date", "d1"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("progress"), eq("--table"), eq("people"), eq("--date"), eq("d1"));
        }
    }

    @Test
    void run_異常ケース_コマンド未指定_ErrorHandlerが呼ばれ終了コード1になること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run();

            mocked.verify(() -> ErrorHandler.errorAndExit(
                    eq("A command is required: chunk, import, progress, reset, delete or skip.")));
        }
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_異常ケース_dateが未指定_ErrorHandlerが呼ばれ終了コード1になること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("import", "--table", "people");

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("--table and --date are required.")));
        }
        assertEquals(1, main.getExitCode());
        verifyNoInteractions(coordinator);
    }

    @Test
    void run_異常ケース_未知のコマンド_終了コード1になること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("load", "--table", "people", "--date", "d1");

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("Unknown command: load")));
        }
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_異常ケース_未知のオプション_終了コード1になること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("import", "--table", "people", "--date", "d1", "--fast");

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("Unknown argument: --fast")));
        }
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_正常ケース_chunkを既定値で実行する_設定の行数とポリシーで分割されること() {
        Path source = Paths.get("/data/people-d1.csv");
        when(pathsConfig.resolveSourceFile("people", "d1")).thenReturn(source);
        when(splitter.split(any(), anyString(), anyString(), anyInt(), any()))
                .thenReturn(List.of());

        main.run("chunk", "--table", "people", "--date", "d1");

        verify(splitter).split(source, "people", "d1", 1_000_000, RechunkPolicy.REFUSE);
        assertEquals(0, main.getExitCode());
    }

    @Test
    void run_正常ケース_chunkをオプション指定で実行する_指定値が優先されること() {
        when(splitter.split(any(), anyString(), anyString(), anyInt(), any()))
                .thenReturn(List.of());

        main.run("chunk", "-t", "people", "-d", "d1", "-f", "/tmp/in.csv", "--chunk-size", "500",
                "--rechunk-policy", "append");

        verify(splitter).split(Paths.get("/tmp/in.csv"), "people", "d1", 500,
                RechunkPolicy.APPEND);
        verify(pathsConfig, never()).resolveSourceFile(anyString(), anyString());
    }

    @Test
    void run_正常ケース_importを既定値で実行する_設定値の要求が渡されること() {
        chunkLoadConfig.setDefaultMethod(ImportMethod.PERMISSIVE);
        chunkLoadConfig.setMaxRetries(4);
        when(coordinator.importChunks(any())).thenReturn(summary(0));

        main.run("import", "--table", "people", "--date", "d1");

        ArgumentCaptor<ImportRequest> captor = ArgumentCaptor.forClass(ImportRequest.class);
        verify(coordinator).importChunks(captor.capture());
        ImportRequest request = captor.getValue();
        assertEquals("people", request.getTable());
        assertEquals("d1", request.getDate());
        assertEquals(ImportMethod.PERMISSIVE, request.getMethod());
        assertEquals(4, request.getMaxRetries());
        assertTrue(request.isResume());
        assertTrue(request.getChunkNumbers().isEmpty());
        assertEquals(0, main.getExitCode());
    }

    @Test
    void run_正常ケース_importをオプション指定で実行する_別名と対象チャンクが反映されること() {
        when(coordinator.importChunks(any())).thenReturn(summary(0));

        main.run("import", "--table", "people", "--date", "d1", "--method", "copy",
                "--max-retries", "0", "--no-resume", "--chunks", "3, 1");

        ArgumentCaptor<ImportRequest> captor = ArgumentCaptor.forClass(ImportRequest.class);
        verify(coordinator).importChunks(captor.capture());
        ImportRequest request = captor.getValue();
        assertEquals(ImportMethod.BULK, request.getMethod());
        assertEquals(0, request.getMaxRetries());
        assertFalse(request.isResume());
        assertEquals(Set.of(1, 3), request.getChunkNumbers());
    }

    @Test
    void run_異常ケース_importで失敗チャンクが残る_終了コード1になること() {
        when(coordinator.importChunks(any())).thenReturn(summary(1));

        main.run("import", "--table", "people", "--date", "d1");

        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_異常ケース_importが例外を送出する_致命的エラーとして終了コード1になること() {
        IllegalStateException failure = new IllegalStateException("No chunks planned");
        when(coordinator.importChunks(any())).thenThrow(failure);

        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("import", "--table", "people", "--date", "d1");

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("Fatal error: No chunks planned"),
                    eq(failure)));
        }
        assertEquals(1, main.getExitCode());
    }

    @Test
    void run_正常ケース_progressを実行する_期待総数付きで照会されること() {
        when(progressQuery.query("people", "d1", 8L)).thenReturn(progress());

        main.run("progress", "--table", "people", "--date", "d1", "--expected-total", "8");

        verify(progressQuery).query("people", "d1", 8L);
        verify(progressQuery, never()).listChunks(anyString(), anyString());
        assertEquals(0, main.getExitCode());
    }

    @Test
    void run_正常ケース_progressを詳細指定で実行する_チャンク一覧が取得されること() {
        when(progressQuery.query("people", "d1", 0L)).thenReturn(progress());
        when(progressQuery.listChunks("people", "d1")).thenReturn(List.of());

        main.run("progress", "--table", "people", "--date", "d1", "--detailed");

        verify(progressQuery).listChunks("people", "d1");
    }

    @Test
    void run_正常ケース_resetを実行する_コーディネータに委譲されること() {
        main.run("reset", "--table", "people", "--date", "d1");

        verify(coordinator).resetChunks("people", "d1");
        assertEquals(0, main.getExitCode());
    }

    @Test
    void run_正常ケース_deleteをファイル削除付きで実行する_コーディネータに委譲されること() {
        main.run("delete", "--table", "people", "--date", "d1", "--delete-files");

        verify(coordinator).deleteChunks("people", "d1", true);
    }

    @Test
    void run_正常ケース_skipを実行する_指定チャンクが渡されること() {
        main.run("skip", "--table", "people", "--date", "d1", "--chunks", "2,4");

        verify(coordinator).skipChunks("people", "d1", Set.of(2, 4));
    }

    @Test
    void run_異常ケース_skipでチャンク未指定_終了コード1になること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("skip", "--table", "people", "--date", "d1");

            mocked.verify(() -> ErrorHandler.errorAndExit(eq("--chunks is required for skip.")));
        }
        assertEquals(1, main.getExitCode());
        verifyNoInteractions(coordinator);
    }

    @Test
    void parse_異常ケース_値が欠けている_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Main.Options.parse(new String[] {"--table"}));
        assertEquals("--table requires a value.", ex.getMessage());
    }

    @Test
    void parse_異常ケース_数値でない値_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Main.Options.parse(new String[] {"--chunk-size", "many"}));
        assertEquals("--chunk-size expects a number: many", ex.getMessage());
    }

    @Test
    void parse_異常ケース_int範囲外の値_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> Main.Options.parse(new String[] {"--max-retries", "99999999999"}));
    }

    @Test
    void parse_異常ケース_未知の方式_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> Main.Options.parse(new String[] {"-m", "turbo"}));
    }

    @Test
    void parse_正常ケース_resumeとno_resumeの後勝ち_最後の指定が有効になること() {
        Main.Options options =
                Main.Options.parse(new String[] {"--no-resume", "--resume", "-m", "pandas"});
        assertTrue(options.resume);
        assertEquals(ImportMethod.PERMISSIVE, options.method);
    }
}
