package io.github.yok.chunkload.ledger;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle states of a planned chunk, stored in lower case in the ledger.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum ChunkStatus {

    // Planned, not yet attempted
    PENDING("pending"),

    // An attempt is running
    PROCESSING("processing"),

    // Imported; counters are final
    COMPLETED("completed"),

    // Last attempt failed
    FAILED("failed"),

    // Set aside by an operator
    SKIPPED("skipped");

    private final String value;

    /**
     * Resolves a status from its stored value.
     *
     * @param value stored value such as {@code pending}
     * @return the matching status
     * @throws IllegalArgumentException if the value is unknown
     */
    public static ChunkStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ChunkStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown chunk status: " + value);
    }
}
