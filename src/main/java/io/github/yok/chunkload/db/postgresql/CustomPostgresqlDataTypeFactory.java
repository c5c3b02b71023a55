package io.github.yok.chunkload.db.postgresql;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Locale;
import java.util.Set;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.dataset.datatype.DataTypeException;
import org.dbunit.dataset.datatype.StringDataType;
import org.dbunit.dataset.datatype.TypeCastException;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * Custom {@link org.dbunit.dataset.datatype.IDataTypeFactory} implementation for PostgreSQL.
 *
 * <p>
 * DBUnit's default PostgreSQL factory reports {@code xml}, {@code json} and {@code jsonb} as
 * unknown types, whose binding sends a {@code varchar} parameter the server refuses to assign to
 * those columns. This implementation keeps CSV text for them and binds it as
 * {@link Types#OTHER}, letting the server parse the literal.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class CustomPostgresqlDataTypeFactory extends PostgresqlDataTypeFactory {

    private static final Set<String> SERVER_PARSED_TYPES = Set.of("xml", "json", "jsonb");

    /**
     * Creates DBUnit data type for PostgreSQL.
     *
     * @param sqlType JDBC SQL type
     * @param sqlTypeName database type name
     * @return resolved DBUnit data type
     * @throws DataTypeException if mapping fails
     */
    @Override
    public DataType createDataType(int sqlType, String sqlTypeName) throws DataTypeException {
        if (sqlType == Types.SQLXML || isServerParsedTypeName(sqlTypeName)) {
            return new ServerParsedTextDataType(sqlTypeName == null ? "xml" : sqlTypeName);
        }
        return super.createDataType(sqlType, sqlTypeName);
    }

    private boolean isServerParsedTypeName(String sqlTypeName) {
        if (sqlTypeName == null) {
            return false;
        }
        return SERVER_PARSED_TYPES.contains(sqlTypeName.toLowerCase(Locale.ROOT));
    }

    /**
     * Text data type whose literal is parsed by the server.
     */
    static final class ServerParsedTextDataType extends StringDataType {

        /**
         * Creates the data type.
         *
         * @param typeName PostgreSQL type name
         */
        ServerParsedTextDataType(String typeName) {
            super(typeName.toUpperCase(Locale.ROOT), Types.OTHER);
        }

        /**
         * Binds the value as an untyped literal.
         *
         * @param value value to bind
         * @param column column index
         * @param statement prepared statement
         * @throws SQLException when JDBC operation fails
         * @throws TypeCastException when value cannot be cast to String
         */
        @Override
        public void setSqlValue(Object value, int column, PreparedStatement statement)
                throws SQLException, TypeCastException {
            if (value == null || value == ITable.NO_VALUE) {
                statement.setNull(column, Types.OTHER);
                return;
            }
            statement.setObject(column, typeCast(value), Types.OTHER);
        }
    }
}
