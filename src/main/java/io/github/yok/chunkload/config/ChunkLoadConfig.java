package io.github.yok.chunkload.config;

import io.github.yok.chunkload.core.strategy.ImportMethod;
import java.nio.file.Path;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code chunk.*} section of {@code application.yml}.
 *
 * <p>
 * Example:
 * </p>
 *
 * <pre>
 * chunk:
 *   default-chunk-size: 1000000
 *   batch-size: 10000
 *   max-retries: 3
 *   default-method: strict
 *   rechunk-policy: refuse
 *   chunk-timeout: 6h
 *   stale-after: 30m
 * </pre>
 *
 * <p>
 * Every property has a default, so an application without a {@code chunk} section behaves like
 * the example above.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "chunk")
@Data
public class ChunkLoadConfig {

    // Root directory of chunk files; falls back to {data-path}/chunks when unset
    private Path chunkRoot;

    // Data rows per chunk file
    private int defaultChunkSize = 1_000_000;

    // Rows per committed sub-batch inside a chunk
    private int batchSize = 10_000;

    // Retries after the first failed attempt of a chunk
    private int maxRetries = 3;

    private ImportMethod defaultMethod = ImportMethod.STRICT;

    private RechunkPolicy rechunkPolicy = RechunkPolicy.REFUSE;

    // Deadline of one strategy call; zero disables the deadline
    private Duration chunkTimeout = Duration.ofHours(6);

    // Age after which a processing chunk owned by another host is considered abandoned
    private Duration staleAfter = Duration.ofMinutes(30);

    // Re-import with the strict parser when the bulk loader rejects a chunk
    private boolean bulkFallbackToStrict = false;

    // Maximum length of error messages stored in the ledger
    private int maxErrorLength = 1000;

    // Maximum physical lines the permissive parser joins into one record
    private int permissiveMaxRecordLines = 1000;

    /**
     * Resolves the effective chunk root.
     *
     * @param pathsConfig path configuration providing the default
     * @return configured chunk root, or {@code {data-path}/chunks}
     */
    public Path resolveChunkRoot(PathsConfig pathsConfig) {
        if (chunkRoot != null) {
            return chunkRoot;
        }
        return pathsConfig.getChunkDir();
    }
}
