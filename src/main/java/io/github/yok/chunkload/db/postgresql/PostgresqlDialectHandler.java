package io.github.yok.chunkload.db.postgresql;

import io.github.yok.chunkload.db.DatabaseDialect;
import io.github.yok.chunkload.db.DbDialectHandler;
import io.github.yok.chunkload.db.TableDefinition;
import io.github.yok.chunkload.util.CsvUtils;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;

/**
 * PostgreSQL dialect.
 *
 * <p>
 * The native bulk load streams the chunk through {@code COPY ... FROM STDIN} into a temporary
 * staging table created {@code ON COMMIT DROP}, then moves the rows with
 * {@code INSERT ... SELECT ... ON CONFLICT DO NOTHING} so that rows already present are ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PostgresqlDialectHandler implements DbDialectHandler {

    static final String STAGING_TABLE = "chunkload_staging";

    private final IDataTypeFactory dataTypeFactory = new CustomPostgresqlDataTypeFactory();

    @Override
    public DatabaseDialect getDialect() {
        return DatabaseDialect.POSTGRESQL;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }

    /**
     * Binds text as an untyped parameter so that the server applies its input conversion, as it
     * would for a literal.
     */
    @Override
    public void bindText(PreparedStatement statement, int index, String value, int sqlType)
            throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.OTHER);
            return;
        }
        statement.setObject(index, value, Types.OTHER);
    }

    @Override
    public long bulkLoad(Connection connection, Path chunkFile, TableDefinition table,
            List<String> columns) throws SQLException, IOException {
        String target = quoteIdentifier(table.getName());
        String staging = quoteIdentifier(STAGING_TABLE);
        String columnList =
                columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));

        try (Statement st = connection.createStatement()) {
            st.execute("DROP TABLE IF EXISTS " + staging);
            st.execute("CREATE TEMP TABLE " + staging + " (LIKE " + target
                    + " INCLUDING DEFAULTS) ON COMMIT DROP");
        }

        CopyManager copyManager = connection.unwrap(PGConnection.class).getCopyAPI();
        long copied;
        try (Reader reader = CsvUtils.openLenientReader(chunkFile)) {
            copied = copyManager.copyIn("COPY " + staging + " (" + columnList
                    + ") FROM STDIN WITH (FORMAT csv, HEADER true)", reader);
        }

        int inserted;
        try (Statement st = connection.createStatement()) {
            inserted = st.executeUpdate("INSERT INTO " + target + " (" + columnList + ") SELECT "
                    + columnList + " FROM " + staging + " ON CONFLICT DO NOTHING");
        }
        log.debug("COPY staged {} rows, {} new rows inserted into {}", copied, inserted,
                table.getName());
        return copied;
    }
}
