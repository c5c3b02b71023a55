package io.github.yok.chunkload.exception;

/**
 * Thrown when a source or chunk file cannot be read or written. Fatal to planning.
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceIoException extends ChunkImportException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public SourceIoException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause I/O failure
     */
    public SourceIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
