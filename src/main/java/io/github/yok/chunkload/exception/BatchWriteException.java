package io.github.yok.chunkload.exception;

/**
 * Thrown when the destination rejects a sub-batch even after rollback and retry at reduced
 * granularity. Recovered by retrying the chunk from its start.
 *
 * @author Yasuharu.Okawauchi
 */
public class BatchWriteException extends ChunkImportException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause SQL failure
     */
    public BatchWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
