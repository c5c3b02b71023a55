package io.github.yok.chunkload.core;

import io.github.yok.chunkload.ledger.ChunkStatus;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only progress view of a (table, date) import.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ProgressSummary {

    String table;

    String date;

    int totalChunks;

    Map<ChunkStatus, Integer> statusCounts;

    // Data rows covered by the plan
    long plannedRows;

    // Rows imported by completed chunks
    long rowsImported;

    // Rows skipped by completed chunks
    long rowsSkipped;

    // Denominator of percentComplete
    long expectedTotal;

    // (rowsImported + rowsSkipped) / expectedTotal, capped at 100
    double percentComplete;

    // Completed chunks over total chunks
    double chunkPercent;

    OverallStatus overallStatus;

    /**
     * Returns the number of chunks in a status.
     *
     * @param status chunk status
     * @return count, zero when absent
     */
    public int count(ChunkStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }
}
