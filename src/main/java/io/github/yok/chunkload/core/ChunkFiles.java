package io.github.yok.chunkload.core;

import io.github.yok.chunkload.exception.SourceIoException;
import io.github.yok.chunkload.ledger.ChunkRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.stream.Stream;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Naming and housekeeping of chunk files.
 *
 * <p>
 * Chunks of a (table, date) pair live in {@code {chunk_root}/{table}-{date}/} and are named
 * {@code {table}-{date}.chunk_{NNNN}.csv} with a four-digit, zero-padded chunk number.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ChunkFiles {

    @Generated
    private ChunkFiles() {
        throw new AssertionError("No ChunkFiles instances for you!");
    }

    /**
     * Returns the chunk directory of a (table, date) pair.
     *
     * @param chunkRoot root directory of all chunks
     * @param table table name
     * @param date dataset identifier
     * @return {@code {chunkRoot}/{table}-{date}}
     */
    public static Path directory(Path chunkRoot, String table, String date) {
        return chunkRoot.resolve(table + "-" + date);
    }

    /**
     * Returns the file name of a chunk.
     *
     * @param table table name
     * @param date dataset identifier
     * @param chunkNumber 1-based chunk number
     * @return {@code {table}-{date}.chunk_{NNNN}.csv}
     */
    public static String fileName(String table, String date, int chunkNumber) {
        return String.format("%s-%s.chunk_%04d.csv", table, date, chunkNumber);
    }

    /**
     * Returns the directory an overwrite writes its chunks to before they replace the current ones.
     *
     * @param directory chunk directory of a (table, date) pair
     * @return sibling directory {@code {directory}.rechunk}
     */
    public static Path stagingDirectory(Path directory) {
        return directory.resolveSibling(directory.getFileName() + ".rechunk");
    }

    /**
     * Removes a staging directory left behind by an interrupted overwrite.
     *
     * @param directory directory to remove with its content
     * @throws SourceIoException if the directory cannot be removed
     */
    public static void clear(Path directory) {
        try {
            if (Files.isDirectory(directory)) {
                FileUtils.deleteDirectory(directory.toFile());
                log.debug("Removed stale staging directory {}", directory);
            }
        } catch (IOException e) {
            throw new SourceIoException("Failed to clear " + directory, e);
        }
    }

    /**
     * Moves the files of the given chunks into another directory, replacing files of the same
     * name, then removes the source directory when it is left empty.
     *
     * @param from directory holding the chunk files
     * @param to destination chunk directory, created when missing
     * @param records chunks whose files are moved
     * @throws SourceIoException if a file cannot be moved
     */
    public static void moveAll(Path from, Path to, Collection<ChunkRecord> records) {
        try {
            Files.createDirectories(to);
            for (ChunkRecord record : records) {
                Files.move(from.resolve(record.getChunkFilename()),
                        to.resolve(record.getChunkFilename()),
                        StandardCopyOption.REPLACE_EXISTING);
            }
            if (Files.isDirectory(from) && isEmpty(from)) {
                Files.delete(from);
            }
        } catch (IOException e) {
            throw new SourceIoException("Failed to move chunk files from " + from + " to " + to,
                    e);
        }
    }

    /**
     * Deletes the files of the given chunks, then the chunk directory when it is left empty.
     *
     * @param directory chunk directory
     * @param records chunks whose files are removed
     * @return number of files deleted
     * @throws SourceIoException if a file cannot be deleted
     */
    public static int delete(Path directory, Collection<ChunkRecord> records) {
        int deleted = 0;
        try {
            for (ChunkRecord record : records) {
                if (Files.deleteIfExists(directory.resolve(record.getChunkFilename()))) {
                    deleted++;
                }
            }
            if (Files.isDirectory(directory) && isEmpty(directory)) {
                Files.delete(directory);
                log.debug("Removed empty chunk directory {}", directory);
            }
        } catch (IOException e) {
            throw new SourceIoException("Failed to delete chunk files in " + directory, e);
        }
        return deleted;
    }

    private static boolean isEmpty(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.findAny().isEmpty();
        }
    }
}
