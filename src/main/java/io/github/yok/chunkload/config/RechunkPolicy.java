package io.github.yok.chunkload.config;

import java.util.Locale;

/**
 * Behaviour of the splitter when ledger rows already exist for the same (table, date).
 *
 * @author Yasuharu.Okawauchi
 */
public enum RechunkPolicy {

    // Fail the split and leave existing records untouched
    REFUSE,

    // Remove existing records and chunk files, then split from scratch
    OVERWRITE,

    // Continue numbering and row ranges after the existing chunks
    APPEND;

    /**
     * Resolves a policy from its case-insensitive name.
     *
     * @param value policy name such as {@code refuse}
     * @return the matching policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RechunkPolicy fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rechunk policy must not be null");
        }
        try {
            return RechunkPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rechunk policy: " + value
                    + " (expected refuse, overwrite or append)", e);
        }
    }
}
