package io.github.yok.chunkload.exception;

/**
 * Thrown when the destination column set is empty, unreadable, or shares no column with the chunk
 * header. Fatal to the chunk.
 *
 * @author Yasuharu.Okawauchi
 */
public class SchemaMismatchException extends ChunkImportException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public SchemaMismatchException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause metadata failure
     */
    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
