package io.github.yok.chunkload.exception;

import lombok.Getter;

/**
 * Thrown when a single CSV value cannot be converted to its destination column type. The row is
 * skipped; the chunk continues.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RowCoercionException extends ChunkImportException {

    private static final long serialVersionUID = 1L;

    // Destination column the value was meant for
    private final String column;

    // Raw CSV value
    private final String value;

    /**
     * Creates an exception for one rejected value.
     *
     * @param column destination column name
     * @param value raw value
     * @param cause conversion failure
     */
    public RowCoercionException(String column, String value, Throwable cause) {
        super("Cannot convert value '" + value + "' for column " + column + ": "
                + cause.getMessage(), cause);
        this.column = column;
        this.value = value;
    }
}
