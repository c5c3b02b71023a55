package io.github.yok.chunkload.core.strategy;

import lombok.Value;

/**
 * Counters produced by one successful strategy call.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ImportOutcome {

    // Rows accepted by the destination, including rows ignored as key conflicts
    long rowsImported;

    // Rows rejected before or during the write
    long rowsSkipped;
}
