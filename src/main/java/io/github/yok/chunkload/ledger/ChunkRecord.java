package io.github.yok.chunkload.ledger;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the {@code csv_chunk_progress} ledger.
 *
 * <p>
 * Identity is {@code (tableName, datasetDate, chunkNumber)}. Row ranges are 1-based and inclusive
 * on both ends, counted over data rows of the source file (the header is not a data row).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkRecord {

    private Long id;

    private String tableName;

    private String datasetDate;

    private int chunkNumber;

    // File name relative to the chunk directory of (tableName, datasetDate)
    private String chunkFilename;

    private long chunkStartRow;

    private long chunkEndRow;

    private long chunkRowCount;

    @Builder.Default
    private ChunkStatus status = ChunkStatus.PENDING;

    private long rowsImported;

    private long rowsSkipped;

    private Instant startedAt;

    private Instant completedAt;

    private Long durationMs;

    private String errorMessage;

    private int retryCount;

    private String importMethod;

    // pid@host of the process that last moved the chunk into processing
    private String ownerId;

    private Instant createdAt;

    private Instant updatedAt;
}
