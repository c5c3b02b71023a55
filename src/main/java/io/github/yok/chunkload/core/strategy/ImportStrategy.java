package io.github.yok.chunkload.core.strategy;

import io.github.yok.chunkload.core.ColumnAlignment;
import java.nio.file.Path;

/**
 * Loads one chunk file into the destination table.
 *
 * <p>
 * Implementations commit in bounded sub-batches, ignore primary-key conflicts so that a chunk can
 * be imported again from its start, and report chunk-level failures as
 * {@link io.github.yok.chunkload.exception.ChunkImportException} subclasses.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface ImportStrategy {

    /**
     * Returns the method implemented by this strategy.
     *
     * @return import method
     */
    ImportMethod getMethod();

    /**
     * Imports a chunk file.
     *
     * @param chunkFile chunk CSV file including its header
     * @param table destination table name as requested by the caller
     * @param columns alignment of the chunk header with the destination columns
     * @return imported and skipped row counts
     */
    ImportOutcome importChunk(Path chunkFile, String table, ColumnAlignment columns);
}
