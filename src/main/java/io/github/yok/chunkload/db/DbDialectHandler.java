package io.github.yok.chunkload.db;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.dbunit.dataset.datatype.IDataTypeFactory;

/**
 * Database-dialect behaviour needed by the import strategies.
 *
 * <p>
 * Covers identifier quoting, the conflict-ignoring insert statement used by the row-by-row
 * strategies, the DBUnit data type factory used for value coercion, table metadata lookup, and the
 * product's native bulk-load protocol.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler {

    /**
     * Returns the database product handled by this dialect.
     *
     * @return dialect
     */
    DatabaseDialect getDialect();

    /**
     * Returns the DBUnit data type factory for this database.
     *
     * @return data type factory
     */
    IDataTypeFactory getDataTypeFactory();

    /**
     * Loads a chunk file through the native bulk-load protocol.
     *
     * <p>
     * The CSV header of {@code chunkFile} must name exactly the columns in {@code columns}, in the
     * same order. Primary-key conflicts are ignored. The caller owns the transaction.
     * </p>
     *
     * @param connection connection with auto-commit disabled
     * @param chunkFile chunk CSV file including its header
     * @param table destination table
     * @param columns destination column names in header order
     * @return number of rows accepted by the protocol
     * @throws SQLException if the database rejects the load
     * @throws IOException if the chunk file cannot be read
     */
    long bulkLoad(Connection connection, Path chunkFile, TableDefinition table,
            List<String> columns) throws SQLException, IOException;

    /**
     * Quotes an identifier with double quotes.
     *
     * @param identifier identifier as stored by the database
     * @return quoted identifier
     */
    default String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Builds an insert statement that ignores primary-key conflicts.
     *
     * @param table destination table name as stored by the database
     * @param columns destination column names
     * @return parameterized insert SQL with one placeholder per column
     */
    default String buildInsertIgnoreSql(String table, List<String> columns) {
        String columnList =
                columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        String marks = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + quoteIdentifier(table) + " (" + columnList + ") VALUES (" + marks
                + ") ON CONFLICT DO NOTHING";
    }

    /**
     * Binds a value as text and lets the database convert it to the column type.
     *
     * @param statement prepared statement
     * @param index one-based parameter index
     * @param value text value, {@code null} for SQL NULL
     * @param sqlType {@link java.sql.Types} code of the destination column
     * @throws SQLException if binding fails
     */
    default void bindText(PreparedStatement statement, int index, String value, int sqlType)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, sqlType);
            return;
        }
        statement.setString(index, value);
    }

    /**
     * Reads the column set of a destination table from {@link DatabaseMetaData}.
     *
     * <p>
     * The table name is looked up as given, then in lower case, then in upper case, in the
     * connection's current schema. Nothing is cached; every call reads fresh metadata.
     * </p>
     *
     * @param connection JDBC connection
     * @param table table name as supplied by the caller
     * @return the table definition; its column list is empty when the table does not exist
     * @throws SQLException if metadata access fails
     */
    default TableDefinition readTable(Connection connection, String table) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        String schema = connection.getSchema();
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(table);
        candidates.add(table.toLowerCase(Locale.ROOT));
        candidates.add(table.toUpperCase(Locale.ROOT));
        for (String candidate : candidates) {
            Set<String> primaryKeys = new HashSet<>();
            try (ResultSet rs = meta.getPrimaryKeys(null, schema, candidate)) {
                while (rs.next()) {
                    primaryKeys.add(rs.getString("COLUMN_NAME"));
                }
            }
            List<TableColumn> columns = new ArrayList<>();
            try (ResultSet rs = meta.getColumns(null, schema, candidate, null)) {
                while (rs.next()) {
                    // the table name argument is a LIKE pattern
                    if (!candidate.equals(rs.getString("TABLE_NAME"))) {
                        continue;
                    }
                    String name = rs.getString("COLUMN_NAME");
                    columns.add(new TableColumn(name, rs.getInt("DATA_TYPE"),
                            rs.getString("TYPE_NAME"), primaryKeys.contains(name)));
                }
            }
            if (!columns.isEmpty()) {
                return new TableDefinition(candidate, columns);
            }
        }
        return new TableDefinition(table, List.of());
    }
}
