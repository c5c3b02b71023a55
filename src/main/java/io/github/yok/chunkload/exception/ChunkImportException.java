package io.github.yok.chunkload.exception;

/**
 * Base class of the chunk import error taxonomy.
 *
 * <p>
 * Subclasses describe where an error is recovered: at row level (skip), at chunk level (retry or
 * terminal failure of the chunk) or at planning level (the whole request fails).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ChunkImportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public ChunkImportException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public ChunkImportException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns whether retrying the same chunk with the same strategy can change the outcome.
     *
     * @return {@code true} when a chunk-level retry is worthwhile
     */
    public boolean isRetryable() {
        return true;
    }
}
