package io.github.yok.chunkload.db;

import io.github.yok.chunkload.db.h2.H2DialectHandler;
import io.github.yok.chunkload.db.postgresql.PostgresqlDialectHandler;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to the database type.
 *
 * <p>
 * The dialect is resolved from the JDBC URL first and from the database product name as a
 * fallback. PostgreSQL and H2 are supported.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbDialectHandlerFactory {

    /**
     * Creates a {@link DbDialectHandler} for the database behind a data source.
     *
     * @param dataSource destination data source
     * @return dialect handler
     * @throws IllegalStateException if the database cannot be reached or is not supported
     */
    public DbDialectHandler create(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData meta = connection.getMetaData();
            return create(meta.getURL(), meta.getDatabaseProductName());
        } catch (SQLException e) {
            log.error("Failed to read database metadata", e);
            throw new IllegalStateException("Failed to connect to the database", e);
        }
    }

    /**
     * Creates a {@link DbDialectHandler} from connection attributes.
     *
     * @param jdbcUrl JDBC URL, may be {@code null}
     * @param productName database product name, may be {@code null}
     * @return dialect handler
     * @throws IllegalStateException if the database type cannot be determined
     */
    public DbDialectHandler create(String jdbcUrl, String productName) {
        DatabaseDialect dialect = resolveDialect(jdbcUrl, productName);
        log.info("Database dialect resolved: {}", dialect);
        if (dialect == DatabaseDialect.POSTGRESQL) {
            return new PostgresqlDialectHandler();
        }
        return new H2DialectHandler();
    }

    /**
     * Resolves the database type.
     *
     * <p>
     * Resolution priority is JDBC URL first, then product name.
     * </p>
     *
     * @param jdbcUrl JDBC URL
     * @param productName database product name
     * @return resolved database type
     * @throws IllegalStateException if the database type cannot be determined
     */
    DatabaseDialect resolveDialect(String jdbcUrl, String productName) {
        DatabaseDialect fromUrl = resolveFromJdbcUrl(jdbcUrl);
        if (fromUrl != null) {
            return fromUrl;
        }
        DatabaseDialect fromProduct = resolveFromProductName(productName);
        if (fromProduct != null) {
            return fromProduct;
        }
        throw new IllegalStateException("Unsupported database dialect (url=" + jdbcUrl
                + ", product=" + productName + ")");
    }

    private DatabaseDialect resolveFromJdbcUrl(String jdbcUrl) {
        String normalized = normalizeLower(jdbcUrl);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:postgresql:")) {
            return DatabaseDialect.POSTGRESQL;
        }
        if (normalized.startsWith("jdbc:h2:")) {
            return DatabaseDialect.H2;
        }
        return null;
    }

    private DatabaseDialect resolveFromProductName(String productName) {
        String normalized = normalizeLower(productName);
        if (normalized == null) {
            return null;
        }
        if (normalized.contains("postgresql")) {
            return DatabaseDialect.POSTGRESQL;
        }
        if ("h2".equals(normalized)) {
            return DatabaseDialect.H2;
        }
        return null;
    }

    /**
     * Normalizes a string for case-insensitive comparison.
     *
     * @param value source string
     * @return lower-case value, or {@code null} when input is {@code null} or blank
     */
    private String normalizeLower(String value) {
        if (value == null) {
            return null;
        }
        if (value.isBlank()) {
            return null;
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
