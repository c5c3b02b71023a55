package io.github.yok.chunkload.core;

import io.github.yok.chunkload.core.strategy.ImportMethod;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one import run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class ImportRequest {

    String table;

    String date;

    @Builder.Default
    ImportMethod method = ImportMethod.STRICT;

    // Leave completed and skipped chunks alone
    @Builder.Default
    boolean resume = true;

    // Retries after the first failed attempt of a chunk
    @Builder.Default
    int maxRetries = 3;

    // Chunk numbers to restrict the run to; empty selects every chunk
    @Builder.Default
    Set<Integer> chunkNumbers = Set.of();
}
