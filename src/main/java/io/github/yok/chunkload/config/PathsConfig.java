package io.github.yok.chunkload.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that reads the {@code data-path} property from the application root
 * configuration and composes the directory paths used for source extracts and chunk files.
 *
 * <p>
 * Source extracts are expected directly under {@code data-path} as {@code {table}-{date}.csv};
 * chunk files are written under {@code {data-path}/chunks} unless {@code chunk.chunk-root}
 * overrides it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base path that serves as the application's root data directory
    private String dataPath;

    /**
     * Returns the directory holding the source CSV extracts.
     *
     * @return source directory
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public Path getSourceDir() {
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "data-path is not configured. Please set 'data-path' in application.yml.");
        }
        return Paths.get(dataPath);
    }

    /**
     * Returns the default root directory for chunk files.
     *
     * @return {@code {data-path}/chunks}
     * @throws IllegalStateException if {@code dataPath} has not been set
     */
    public Path getChunkDir() {
        return getSourceDir().resolve("chunks");
    }

    /**
     * Returns the conventional source file of a (table, date) pair.
     *
     * @param table destination table name
     * @param date dataset identifier
     * @return {@code {data-path}/{table}-{date}.csv}
     */
    public Path resolveSourceFile(String table, String date) {
        return getSourceDir().resolve(table + "-" + date + ".csv");
    }
}
