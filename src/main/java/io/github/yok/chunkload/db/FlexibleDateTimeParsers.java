package io.github.yok.chunkload.db;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import lombok.Generated;

/**
 * Shared flexible {@link DateTimeFormatter} constants used to coerce CSV text into temporal
 * column values.
 *
 * <p>
 * Extracts produced by database dumps mix {@code T} and space separators, carry optional
 * fractional seconds and sometimes a zone offset; these parsers accept all of them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class FlexibleDateTimeParsers {

    /**
     * Local-time parser accepting {@code HH:mm}, {@code HH:mm:ss} and {@code HH:mm:ss.fraction}.
     */
    public static final DateTimeFormatter LOCAL_TIME =
            new DateTimeFormatterBuilder().appendPattern("HH:mm").optionalStart()
                    .appendPattern(":ss").optionalEnd().optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                    .toFormatter();

    /**
     * Date-time parser accepting {@code yyyy-MM-dd HH:mm[:ss[.fraction]]} with a {@code T} or a
     * space separator and an optional offset such as {@code +00}, {@code +09:00} or {@code Z}.
     */
    public static final DateTimeFormatter DATE_TIME =
            new DateTimeFormatterBuilder().append(DateTimeFormatter.ISO_LOCAL_DATE)
                    .optionalStart().appendLiteral('T').optionalEnd().optionalStart()
                    .appendLiteral(' ').optionalEnd().append(LOCAL_TIME).optionalStart()
                    .appendOffset("+HH:mm", "Z").optionalEnd().optionalStart()
                    .appendOffset("+HH", "Z").optionalEnd().toFormatter();

    /**
     * Date-only formatters tried in order.
     * <ol>
     * <li>{@code yyyy-MM-dd} (ISO)</li>
     * <li>{@code yyyy/MM/dd}</li>
     * <li>{@code yyyyMMdd} (basic ISO)</li>
     * </ol>
     */
    public static final DateTimeFormatter[] DATE_ONLY_FORMATTERS =
            {DateTimeFormatter.ISO_LOCAL_DATE, DateTimeFormatter.ofPattern("yyyy/MM/dd"),
                    DateTimeFormatter.BASIC_ISO_DATE};

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private FlexibleDateTimeParsers() {
        throw new AssertionError("No FlexibleDateTimeParsers instances for you!");
    }
}
