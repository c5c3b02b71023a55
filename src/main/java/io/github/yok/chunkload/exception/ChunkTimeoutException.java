package io.github.yok.chunkload.exception;

import java.time.Duration;

/**
 * Thrown when a strategy call exceeds the per-chunk deadline.
 *
 * @author Yasuharu.Okawauchi
 */
public class ChunkTimeoutException extends ChunkImportException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception for an exceeded deadline.
     *
     * @param chunkNumber chunk number
     * @param timeout configured deadline
     */
    public ChunkTimeoutException(int chunkNumber, Duration timeout) {
        super("Chunk " + chunkNumber + " did not finish within " + timeout);
    }
}
