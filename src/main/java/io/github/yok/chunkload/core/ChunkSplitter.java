package io.github.yok.chunkload.core;

import com.google.common.base.Preconditions;
import io.github.yok.chunkload.config.ChunkLoadConfig;
import io.github.yok.chunkload.config.PathsConfig;
import io.github.yok.chunkload.config.RechunkPolicy;
import io.github.yok.chunkload.exception.SourceIoException;
import io.github.yok.chunkload.ledger.ChunkLedger;
import io.github.yok.chunkload.ledger.ChunkRecord;
import io.github.yok.chunkload.util.CsvUtils;
import io.github.yok.chunkload.util.LogPathUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Splits a source CSV extract into chunk files and plans one ledger row per chunk.
 *
 * <p>
 * The source is streamed record by record: each record is written to the current chunk file as
 * soon as it is read, so memory use does not depend on the file size. Records are parsed by Apache
 * Commons CSV, which keeps quoted multi-line fields intact. Every chunk file starts with the source
 * header.
 * </p>
 *
 * <p>
 * Ledger rows are inserted in one batch once all files are written. If splitting fails, the files
 * written so far are removed and the ledger is left untouched. An overwrite writes the new chunks
 * to a staging directory and replaces the previous plan only after the split succeeded.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkSplitter {

    private final ChunkLedger ledger;

    private final ChunkLoadConfig config;

    private final PathsConfig pathsConfig;

    private final Clock clock;

    /**
     * Splits a source file using the configured re-chunk policy.
     *
     * @param source source CSV file
     * @param table destination table name
     * @param date dataset identifier
     * @param chunkSize data rows per chunk
     * @return planned chunks in chunk-number order
     */
    public List<ChunkRecord> split(Path source, String table, String date, int chunkSize) {
        return split(source, table, date, chunkSize, config.getRechunkPolicy());
    }

    /**
     * Splits a source file.
     *
     * @param source source CSV file
     * @param table destination table name
     * @param date dataset identifier
     * @param chunkSize data rows per chunk, greater than zero
     * @param policy behaviour when chunks already exist for (table, date)
     * @return chunks planned by this call in chunk-number order; empty when the source has no
     *         data rows
     * @throws IllegalArgumentException if {@code chunkSize} is not positive or a name is blank
     * @throws IllegalStateException if chunks exist and the policy is {@link RechunkPolicy#REFUSE}
     * @throws SourceIoException if the source cannot be read or a chunk cannot be written
     */
    public List<ChunkRecord> split(Path source, String table, String date, int chunkSize,
            RechunkPolicy policy) {
        Preconditions.checkArgument(chunkSize > 0, "chunk size must be greater than 0: %s",
                chunkSize);
        Preconditions.checkArgument(StringUtils.isNotBlank(table), "table must not be blank");
        Preconditions.checkArgument(StringUtils.isNotBlank(date), "date must not be blank");
        Preconditions.checkNotNull(policy, "policy must not be null");
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw new SourceIoException("Source file is missing or unreadable: " + source);
        }

        String label = table + "-" + date;
        Path directory = ChunkFiles.directory(config.resolveChunkRoot(pathsConfig), table, date);

        int firstNumber = 1;
        long firstRow = 1;
        boolean replacing = false;
        List<ChunkRecord> existing = ledger.findByTableAndDate(table, date);
        if (!existing.isEmpty()) {
            switch (policy) {
                case REFUSE:
                    throw new IllegalStateException(existing.size() + " chunks already exist for "
                            + label + "; delete them or choose the overwrite or append policy");
                case OVERWRITE:
                    log.info("[{}] Overwriting {} existing chunks", label, existing.size());
                    replacing = true;
                    break;
                case APPEND:
                    ChunkRecord last = existing.stream()
                            .max(Comparator.comparingInt(ChunkRecord::getChunkNumber)).get();
                    firstNumber = last.getChunkNumber() + 1;
                    firstRow = existing.stream().mapToLong(ChunkRecord::getChunkEndRow).max()
                            .getAsLong() + 1;
                    log.info("[{}] Appending after chunk {} (row {})", label,
                            last.getChunkNumber(), firstRow - 1);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported rechunk policy: " + policy);
            }
        }

        // an overwrite is written next to the current plan and swapped in once it is recorded
        Path target = replacing ? ChunkFiles.stagingDirectory(directory) : directory;
        if (replacing) {
            ChunkFiles.clear(target);
        }

        log.info("=== Splitting {} into chunks of {} rows ===", LogPathUtil.render(source),
                chunkSize);
        List<ChunkRecord> planned = writeChunks(source, table, date, chunkSize, target,
                firstNumber, firstRow);
        try {
            if (replacing) {
                ledger.replaceAll(table, date, planned, clock.instant());
            } else {
                ledger.insertAll(planned, clock.instant());
            }
        } catch (RuntimeException e) {
            ChunkFiles.delete(target, planned);
            throw e;
        }
        if (replacing) {
            ChunkFiles.delete(directory, existing);
            ChunkFiles.moveAll(target, directory, planned);
        }

        long totalRows = planned.stream().mapToLong(ChunkRecord::getChunkRowCount).sum();
        log.info("=== Split complete: {} chunks, {} rows, directory {} ===", planned.size(),
                totalRows, LogPathUtil.render(directory));
        return planned;
    }

    private List<ChunkRecord> writeChunks(Path source, String table, String date, int chunkSize,
            Path directory, int firstNumber, long firstRow) {
        String label = table + "-" + date;
        List<ChunkRecord> planned = new ArrayList<>();
        List<Path> written = new ArrayList<>();
        CSVPrinter printer = null;
        try (CSVParser parser = CsvUtils.openParser(source)) {
            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) {
                log.warn("[{}] Source file is empty; nothing to split", label);
                return planned;
            }
            List<String> header = CsvUtils.toList(it.next());

            int chunkNumber = firstNumber;
            long chunkStart = firstRow;
            long rowsInChunk = 0;
            Path current = null;
            while (it.hasNext()) {
                CSVRecord record = it.next();
                if (printer == null) {
                    Files.createDirectories(directory);
                    current = directory.resolve(ChunkFiles.fileName(table, date, chunkNumber));
                    written.add(current);
                    printer = CsvUtils.openPrinter(current);
                    printer.printRecord(header);
                }
                printer.printRecord(record);
                rowsInChunk++;
                if (rowsInChunk == chunkSize) {
                    printer.close();
                    printer = null;
                    planned.add(plan(table, date, chunkNumber, current, chunkStart, rowsInChunk));
                    chunkNumber++;
                    chunkStart += rowsInChunk;
                    rowsInChunk = 0;
                }
            }
            if (printer != null) {
                printer.close();
                printer = null;
                planned.add(plan(table, date, chunkNumber, current, chunkStart, rowsInChunk));
            }
            if (planned.isEmpty()) {
                log.warn("[{}] Source file has a header but no data rows; nothing to split",
                        label);
            }
            return planned;
        } catch (IOException | UncheckedIOException e) {
            closeQuietly(printer);
            cleanUp(written);
            throw new SourceIoException("Failed to split " + source + ": " + e.getMessage(), e);
        }
    }

    private ChunkRecord plan(String table, String date, int chunkNumber, Path file, long start,
            long rows) {
        log.info("[{}-{}] Chunk {} written: rows {}-{} ({} rows)", table, date, chunkNumber,
                start, start + rows - 1, rows);
        return ChunkRecord.builder().tableName(table).datasetDate(date).chunkNumber(chunkNumber)
                .chunkFilename(file.getFileName().toString()).chunkStartRow(start)
                .chunkEndRow(start + rows - 1).chunkRowCount(rows).build();
    }

    private void closeQuietly(CSVPrinter printer) {
        if (printer == null) {
            return;
        }
        try {
            printer.close();
        } catch (IOException e) {
            log.warn("Failed to close chunk file after a split error: {}", e.getMessage());
        }
    }

    private void cleanUp(List<Path> written) {
        for (Path file : written) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("Failed to remove partial chunk file {}: {}", file, e.getMessage());
            }
        }
    }
}
