package io.github.yok.chunkload.util;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility for rendering file and directory paths in log lines.
 *
 * <p>
 * Paths under the working directory are rendered relative to it; any other path is rendered
 * absolute and normalized.
 * </p>
 */
@Slf4j
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {
        throw new AssertionError("No LogPathUtil instances for you!");
    }

    /**
     * Renders a path for logs.
     *
     * @param path file or directory
     * @return path string rendered for logs
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public static String render(Path path) {
        Preconditions.checkNotNull(path, "path must not be null");
        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = path.toAbsolutePath().normalize();
        if (abs.startsWith(base) && !abs.equals(base)) {
            return base.relativize(abs).toString();
        }
        return abs.toString();
    }
}
