package io.github.yok.chunkload.exception;

/**
 * Thrown by the bulk loader when the chunk does not align exactly with the destination table.
 * Fatal to the chunk under that strategy only; another strategy may still import it.
 *
 * @author Yasuharu.Okawauchi
 */
public class StrategyIncompatibilityException extends ChunkImportException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public StrategyIncompatibilityException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and cause.
     *
     * @param message detail message
     * @param cause protocol failure
     */
    public StrategyIncompatibilityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
