package io.github.yok.chunkload.db.h2;

import io.github.yok.chunkload.db.DatabaseDialect;
import io.github.yok.chunkload.db.DbDialectHandler;
import io.github.yok.chunkload.db.TableDefinition;
import io.github.yok.chunkload.util.CsvUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;

/**
 * H2 dialect, used for embedded destinations and local runs.
 *
 * <p>
 * The native bulk load reads the chunk with {@code CSVREAD}. Tables with a primary key are loaded
 * with {@code MERGE ... KEY}, so re-importing a chunk rewrites the same rows; tables without one
 * get a plain {@code INSERT}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class H2DialectHandler implements DbDialectHandler {

    private final IDataTypeFactory dataTypeFactory = new H2DataTypeFactory();

    @Override
    public DatabaseDialect getDialect() {
        return DatabaseDialect.H2;
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }

    @Override
    public long bulkLoad(Connection connection, Path chunkFile, TableDefinition table,
            List<String> columns) throws SQLException, IOException {
        List<String> header = CsvUtils.readHeader(chunkFile);
        String target = quoteIdentifier(table.getName());
        String columnList =
                columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        // CSVREAD exposes the header spelling, which may differ in case from the table's
        String selectList =
                header.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        String source = " SELECT " + selectList
                + " FROM CSVREAD(?, NULL, 'charset=UTF-8 caseSensitiveColumnNames=true')";

        List<String> keys = table.getPrimaryKeyColumns();
        String sql;
        if (keys.isEmpty()) {
            sql = "INSERT INTO " + target + " (" + columnList + ")" + source;
        } else {
            String keyList =
                    keys.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
            sql = "MERGE INTO " + target + " (" + columnList + ") KEY (" + keyList + ")" + source;
        }

        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, chunkFile.toAbsolutePath().toString());
            int rows = ps.executeUpdate();
            log.debug("CSVREAD loaded {} rows into {}", rows, table.getName());
            return rows;
        }
    }
}
