package io.github.yok.chunkload.core.strategy;

import java.util.Locale;
import lombok.Getter;

/**
 * Loading strategies selectable by name.
 *
 * <p>
 * Each constant has a canonical name and an alias kept for operators used to the older names.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ImportMethod {

    // Commons CSV parsing with DBUnit type coercion
    STRICT("strict", "standard"),

    // Line-oriented tolerant parsing, values bound as text
    PERMISSIVE("permissive", "pandas"),

    // Native bulk-load protocol of the destination
    BULK("bulk", "copy");

    private final String value;

    private final String alias;

    ImportMethod(String value, String alias) {
        this.value = value;
        this.alias = alias;
    }

    /**
     * Resolves a method from its name or alias, ignoring case.
     *
     * @param name method name such as {@code strict} or {@code copy}
     * @return the matching method
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ImportMethod fromValue(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ImportMethod method : values()) {
                if (method.value.equals(normalized) || method.alias.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new IllegalArgumentException("Unknown import method: " + name
                + " (expected strict|standard, permissive|pandas or bulk|copy)");
    }
}
