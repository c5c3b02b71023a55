package io.github.yok.chunkload.core.strategy;

import io.github.yok.chunkload.config.ChunkLoadConfig;
import io.github.yok.chunkload.db.DbDialectHandler;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link ImportStrategy} for an {@link ImportMethod}.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@RequiredArgsConstructor
public class ImportStrategyFactory {

    private final DataSource dataSource;

    private final DbDialectHandler dialect;

    private final ChunkLoadConfig config;

    /**
     * Creates a strategy.
     *
     * @param method import method
     * @return a new strategy instance
     */
    public ImportStrategy create(ImportMethod method) {
        switch (method) {
            case STRICT:
                return new StrictParserStrategy(dataSource, dialect, config.getBatchSize());
            case PERMISSIVE:
                return new PermissiveParserStrategy(dataSource, dialect, config.getBatchSize(),
                        config.getPermissiveMaxRecordLines());
            case BULK:
                return new BulkLoadStrategy(dataSource, dialect);
            default:
                throw new IllegalArgumentException("Unsupported import method: " + method);
        }
    }
}
