package io.github.yok.chunkload.core.strategy;

import io.github.yok.chunkload.db.FlexibleDateTimeParsers;
import io.github.yok.chunkload.db.TableColumn;
import io.github.yok.chunkload.exception.RowCoercionException;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Set;
import lombok.Generated;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.dataset.datatype.TypeCastException;

/**
 * Converts CSV text into values bindable through a DBUnit {@link DataType}.
 *
 * <p>
 * Empty strings and the tokens {@code NULL} and {@code nan} become SQL NULL. Boolean columns
 * accept the PostgreSQL spellings {@code t}/{@code f} besides {@code true}/{@code false},
 * {@code yes}/{@code no} and {@code 1}/{@code 0}. Temporal columns accept the formats of
 * {@link FlexibleDateTimeParsers}. Integer columns take only whole numbers inside the range of
 * the column type. Every other column is converted by {@link DataType#typeCast(Object)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ValueCoercer {

    private static final Set<String> NULL_TOKENS = Set.of("", "null", "nan");

    private static final Set<String> TRUE_TOKENS = Set.of("t", "true", "yes", "y", "1");

    private static final Set<String> FALSE_TOKENS = Set.of("f", "false", "no", "n", "0");

    @Generated
    private ValueCoercer() {
        throw new AssertionError("No ValueCoercer instances for you!");
    }

    /**
     * Returns whether a raw value stands for SQL NULL.
     *
     * @param raw raw CSV value, may be {@code null}
     * @return {@code true} for {@code null}, empty, {@code NULL} or {@code nan} in any case
     */
    public static boolean isNullToken(String raw) {
        return raw == null || NULL_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Converts one raw value for its destination column.
     *
     * @param raw raw CSV value
     * @param column destination column
     * @param type DBUnit data type of the column
     * @return converted value, or {@code null} for SQL NULL
     * @throws RowCoercionException if the value cannot be converted
     */
    public static Object coerce(String raw, TableColumn column, DataType type) {
        if (isNullToken(raw)) {
            return null;
        }
        try {
            switch (column.getSqlType()) {
                case Types.BOOLEAN:
                case Types.BIT:
                    return toBoolean(raw);
                case Types.DATE:
                    return Date.valueOf(toLocalDate(raw.trim()));
                case Types.TIME:
                    return Time.valueOf(LocalTime.parse(raw.trim(),
                            FlexibleDateTimeParsers.LOCAL_TIME));
                case Types.TIMESTAMP:
                case Types.TIMESTAMP_WITH_TIMEZONE:
                    return toTimestamp(raw.trim());
                case Types.TINYINT:
                    return (int) new BigDecimal(raw.trim()).byteValueExact();
                case Types.SMALLINT:
                    return (int) new BigDecimal(raw.trim()).shortValueExact();
                case Types.INTEGER:
                    return new BigDecimal(raw.trim()).intValueExact();
                case Types.BIGINT:
                    return new BigDecimal(raw.trim()).longValueExact();
                default:
                    return type.typeCast(raw);
            }
        } catch (TypeCastException | DateTimeParseException | IllegalArgumentException
                | ArithmeticException e) {
            throw new RowCoercionException(column.getName(), raw, e);
        }
    }

    private static Boolean toBoolean(String raw) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(normalized)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(normalized)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean");
    }

    private static LocalDate toLocalDate(String text) {
        for (DateTimeFormatter formatter : FlexibleDateTimeParsers.DATE_ONLY_FORMATTERS) {
            ParsePosition position = new ParsePosition(0);
            formatter.parseUnresolved(text, position);
            if (position.getErrorIndex() < 0 && position.getIndex() == text.length()) {
                return LocalDate.parse(text, formatter);
            }
        }
        // a date column exported with a midnight time part
        return toLocalDateTime(text).toLocalDate();
    }

    private static Timestamp toTimestamp(String text) {
        if (text.length() <= 10) {
            return Timestamp.valueOf(toLocalDate(text).atStartOfDay());
        }
        TemporalAccessor parsed = FlexibleDateTimeParsers.DATE_TIME.parseBest(text,
                OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return Timestamp.from(((OffsetDateTime) parsed).toInstant());
        }
        return Timestamp.valueOf((LocalDateTime) parsed);
    }

    private static LocalDateTime toLocalDateTime(String text) {
        TemporalAccessor parsed = FlexibleDateTimeParsers.DATE_TIME.parseBest(text,
                OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toLocalDateTime();
        }
        return (LocalDateTime) parsed;
    }
}
