package io.github.yok.chunkload.core;

import io.github.yok.chunkload.ledger.ChunkLedger;
import io.github.yok.chunkload.ledger.ChunkRecord;
import io.github.yok.chunkload.ledger.ChunkStatus;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Read-only aggregation over the ledger; safe to call while an import runs.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@RequiredArgsConstructor
public class ProgressQuery {

    private final ChunkLedger ledger;

    /**
     * Computes the progress of a (table, date) import.
     *
     * <p>
     * Percent complete counts imported and skipped rows of completed chunks against
     * {@code expectedTotal}; when {@code expectedTotal} is not positive the planned row total is
     * used instead.
     * </p>
     *
     * @param table table name
     * @param date dataset identifier
     * @param expectedTotal externally known total row count, or 0
     * @return progress summary
     */
    public ProgressSummary query(String table, String date, long expectedTotal) {
        List<ChunkRecord> records = ledger.findByTableAndDate(table, date);

        Map<ChunkStatus, Integer> counts = new EnumMap<>(ChunkStatus.class);
        for (ChunkStatus status : ChunkStatus.values()) {
            counts.put(status, 0);
        }
        long planned = 0;
        long imported = 0;
        long skipped = 0;
        for (ChunkRecord r : records) {
            counts.merge(r.getStatus(), 1, Integer::sum);
            planned += r.getChunkRowCount();
            if (r.getStatus() == ChunkStatus.COMPLETED) {
                imported += r.getRowsImported();
                skipped += r.getRowsSkipped();
            }
        }

        long denominator = expectedTotal > 0 ? expectedTotal : planned;
        double percent = denominator > 0
                ? Math.min(100.0, (imported + skipped) * 100.0 / denominator)
                : 0.0;
        double chunkPercent = records.isEmpty() ? 0.0
                : counts.get(ChunkStatus.COMPLETED) * 100.0 / records.size();

        return ProgressSummary.builder().table(table).date(date).totalChunks(records.size())
                .statusCounts(counts).plannedRows(planned).rowsImported(imported)
                .rowsSkipped(skipped).expectedTotal(denominator).percentComplete(percent)
                .chunkPercent(chunkPercent).overallStatus(overallStatus(counts, records.size()))
                .build();
    }

    /**
     * Lists the chunk records of a (table, date) pair in chunk-number order.
     *
     * @param table table name
     * @param date dataset identifier
     * @return chunk records
     */
    public List<ChunkRecord> listChunks(String table, String date) {
        return ledger.findByTableAndDate(table, date);
    }

    static OverallStatus overallStatus(Map<ChunkStatus, Integer> counts, int total) {
        if (total == 0) {
            return OverallStatus.NOT_STARTED;
        }
        int completed = counts.get(ChunkStatus.COMPLETED);
        if (completed + counts.get(ChunkStatus.SKIPPED) == total) {
            return OverallStatus.COMPLETED;
        }
        if (counts.get(ChunkStatus.FAILED) > 0) {
            return OverallStatus.FAILED;
        }
        if (counts.get(ChunkStatus.PROCESSING) > 0) {
            return OverallStatus.PROCESSING;
        }
        if (completed > 0) {
            return OverallStatus.IN_PROGRESS;
        }
        return OverallStatus.PENDING;
    }
}
