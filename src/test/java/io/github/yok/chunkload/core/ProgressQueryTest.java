package io.github.yok.chunkload.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import io.github.yok.chunkload.ledger.ChunkLedger;
import io.github.yok.chunkload.ledger.ChunkRecord;
import io.github.yok.chunkload.ledger.ChunkStatus;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProgressQueryTest {

    private ChunkLedger ledger;
    private ProgressQuery query;

    @BeforeEach
    void setUp() {
        ledger = mock(ChunkLedger.class);
        query = new ProgressQuery(ledger);
    }

    private static ChunkRecord chunk(int number, ChunkStatus status, long rows, long imported,
            long skipped) {
        return ChunkRecord.builder().tableName("people").datasetDate("d1").chunkNumber(number)
                .chunkRowCount(rows).status(status).rowsImported(imported).rowsSkipped(skipped)
                .build();
    }

    private void givenChunks(ChunkRecord... records) {
        when(ledger.findByTableAndDate("people", "d1")).thenReturn(List.of(records));
    }

    @Test
    void query_正常ケース_チャンクが無い_not_startedで進捗0であること() {
        givenChunks();

        ProgressSummary p = query.query("people", "d1", 0);

        assertEquals(OverallStatus.NOT_STARTED, p.getOverallStatus());
        assertEquals(0, p.getTotalChunks());
        assertEquals(0.0, p.getPercentComplete());
        assertEquals(0.0, p.getChunkPercent());
    }

    @Test
    void query_正常ケース_完了チャンクが無い_進捗0でpendingであること() {
        givenChunks(chunk(1, ChunkStatus.PENDING, 4, 0, 0), chunk(2, ChunkStatus.PENDING, 4, 0,
                0));

        ProgressSummary p = query.query("people", "d1", 0);

        assertEquals(0.0, p.getPercentComplete());
        assertEquals(OverallStatus.PENDING, p.getOverallStatus());
        assertEquals(8L, p.getPlannedRows());
        assertEquals(2, p.count(ChunkStatus.PENDING));
    }

    @Test
    void query_正常ケース_一部完了している_スキップ行も処理済みとして計上されること() {
        givenChunks(chunk(1, ChunkStatus.COMPLETED, 4, 3, 1), chunk(2, ChunkStatus.PENDING, 4,
                0, 0), chunk(3, ChunkStatus.FAILED, 2, 5, 5));

        ProgressSummary p = query.query("people", "d1", 0);

        assertEquals(3L, p.getRowsImported());
        assertEquals(1L, p.getRowsSkipped());
        assertEquals(10L, p.getExpectedTotal());
        assertEquals(40.0, p.getPercentComplete(), 1e-9);
        assertEquals(100.0 / 3, p.getChunkPercent(), 1e-9);
        assertEquals(OverallStatus.FAILED, p.getOverallStatus());
    }

    @Test
    void query_正常ケース_期待総数を指定する_分母に使われ上限100で打ち切られること() {
        givenChunks(chunk(1, ChunkStatus.COMPLETED, 4, 4, 0), chunk(2, ChunkStatus.COMPLETED, 4,
                4, 0));

        assertEquals(50.0, query.query("people", "d1", 16).getPercentComplete(), 1e-9);
        assertEquals(16L, query.query("people", "d1", 16).getExpectedTotal());
        assertEquals(100.0, query.query("people", "d1", 5).getPercentComplete(), 1e-9);
        assertEquals(100.0, query.query("people", "d1", 0).getPercentComplete(), 1e-9);
    }

    @Test
    void query_正常ケース_全チャンクが完了またはスキップ_completedであること() {
        givenChunks(chunk(1, ChunkStatus.COMPLETED, 4, 4, 0), chunk(2, ChunkStatus.SKIPPED, 4, 0,
                0));

        ProgressSummary p = query.query("people", "d1", 0);

        assertEquals(OverallStatus.COMPLETED, p.getOverallStatus());
        assertEquals(50.0, p.getPercentComplete(), 1e-9);
    }

    @Test
    void overallStatus_正常ケース_状態の組合せを指定する_優先順位どおりに判定されること() {
        assertEquals(OverallStatus.PROCESSING, ProgressQuery.overallStatus(
                counts(ChunkStatus.PROCESSING, ChunkStatus.COMPLETED), 2));
        assertEquals(OverallStatus.FAILED, ProgressQuery.overallStatus(
                counts(ChunkStatus.PROCESSING, ChunkStatus.FAILED), 2));
        assertEquals(OverallStatus.IN_PROGRESS, ProgressQuery.overallStatus(
                counts(ChunkStatus.PENDING, ChunkStatus.COMPLETED), 2));
        assertEquals(OverallStatus.PENDING,
                ProgressQuery.overallStatus(counts(ChunkStatus.PENDING, ChunkStatus.SKIPPED), 2));
        assertEquals(OverallStatus.COMPLETED,
                ProgressQuery.overallStatus(counts(ChunkStatus.SKIPPED), 1));
    }

    @Test
    void listChunks_正常ケース_一覧を取得する_台帳の内容がそのまま返されること() {
        List<ChunkRecord> records = new ArrayList<>();
        records.add(chunk(1, ChunkStatus.PENDING, 4, 0, 0));
        when(ledger.findByTableAndDate("people", "d1")).thenReturn(records);

        assertEquals(records, query.listChunks("people", "d1"));
    }

    private static Map<ChunkStatus, Integer> counts(ChunkStatus... statuses) {
        Map<ChunkStatus, Integer> counts = new EnumMap<>(ChunkStatus.class);
        for (ChunkStatus status : ChunkStatus.values()) {
            counts.put(status, 0);
        }
        for (ChunkStatus status : statuses) {
            counts.merge(status, 1, Integer::sum);
        }
        return counts;
    }
}
