package io.github.yok.chunkload.core;

import io.github.yok.chunkload.core.strategy.ImportMethod;
import io.github.yok.chunkload.ledger.ChunkStatus;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one import run, derived from the run and the ledger; never persisted.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ImportRunSummary {

    String table;

    String date;

    ImportMethod method;

    int totalChunks;

    // Ledger status counts after the run, over every chunk of (table, date)
    Map<ChunkStatus, Integer> statusCounts;

    // Chunks attempted by this run
    int processedChunks;

    int successfulChunks;

    int failedChunks;

    // Chunks left alone because they were completed or skipped before the run
    int resumedChunks;

    long rowsImported;

    long rowsSkipped;

    Duration elapsed;

    List<ChunkError> errors;

    /**
     * Returns whether any chunk of this run ended failed.
     *
     * @return {@code true} if at least one chunk failed
     */
    public boolean hasFailures() {
        return failedChunks > 0;
    }

    /**
     * Terminal failure of one chunk.
     */
    @Value
    public static class ChunkError {

        int chunkNumber;

        String message;

        // Attempts made, including the first one
        int attempts;
    }
}
