package io.github.yok.chunkload.core;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.chunkload.config.ChunkLoadConfig;
import io.github.yok.chunkload.config.PathsConfig;
import io.github.yok.chunkload.core.ImportRunSummary.ChunkError;
import io.github.yok.chunkload.core.strategy.ImportMethod;
import io.github.yok.chunkload.core.strategy.ImportOutcome;
import io.github.yok.chunkload.core.strategy.ImportStrategyFactory;
import io.github.yok.chunkload.db.DbDialectHandler;
import io.github.yok.chunkload.db.TableDefinition;
import io.github.yok.chunkload.exception.ChunkImportException;
import io.github.yok.chunkload.exception.ChunkTimeoutException;
import io.github.yok.chunkload.exception.SchemaMismatchException;
import io.github.yok.chunkload.exception.StrategyIncompatibilityException;
import io.github.yok.chunkload.ledger.ChunkLedger;
import io.github.yok.chunkload.ledger.ChunkRecord;
import io.github.yok.chunkload.ledger.ChunkStatus;
import io.github.yok.chunkload.util.CsvUtils;
import io.github.yok.chunkload.util.ProcessIdentity;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Imports the planned chunks of a (table, date) pair one at a time, in chunk-number order.
 *
 * <p>
 * Each chunk moves {@code pending -> processing -> completed | failed}. A failed attempt is retried
 * up to {@link ImportRequest#getMaxRetries()} times unless retrying cannot change the outcome
 * (schema mismatch, bulk incompatibility, missing file). A chunk failure never stops the run;
 * a ledger failure does, and surfaces as Spring {@code DataAccessException}.
 * </p>
 *
 * <p>
 * All ledger mutations of an import, including the operator actions reset, delete and skip, go
 * through this class.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImportCoordinator {

    private static final Duration CANCEL_GRACE = Duration.ofSeconds(5);

    private final ChunkLedger ledger;

    private final ColumnAligner aligner;

    private final ImportStrategyFactory strategyFactory;

    private final ChunkReconciler reconciler;

    private final DataSource dataSource;

    private final DbDialectHandler dialect;

    private final ChunkLoadConfig config;

    private final PathsConfig pathsConfig;

    private final ProcessIdentity identity;

    private final Clock clock;

    /**
     * Imports the selected chunks.
     *
     * @param request run parameters
     * @return run summary
     * @throws IllegalStateException if nothing is planned or another run is active
     * @throws IllegalArgumentException if a requested chunk number is not planned
     */
    public ImportRunSummary importChunks(ImportRequest request) {
        Preconditions.checkNotNull(request, "request must not be null");
        Preconditions.checkArgument(request.getMaxRetries() >= 0,
                "max retries must not be negative: %s", request.getMaxRetries());
        String table = request.getTable();
        String date = request.getDate();
        String label = table + "-" + date;

        if (ledger.findByTableAndDate(table, date).isEmpty()) {
            throw new IllegalStateException(
                    "No chunks planned for " + label + "; split the source file first");
        }
        reconciler.reconcile(table, date);

        List<ChunkRecord> records = ledger.findByTableAndDate(table, date);
        List<ChunkRecord> selected = select(records, request.getChunkNumbers(), label);

        Instant runStart = clock.instant();
        log.info("=== Import start: {} ({} of {} chunks, method={}, resume={}, maxRetries={}) ===",
                label, selected.size(), records.size(), request.getMethod().getValue(),
                request.isResume(), request.getMaxRetries());

        int processed = 0;
        int successful = 0;
        int failed = 0;
        int resumed = 0;
        long rowsImported = 0;
        long rowsSkipped = 0;
        List<ChunkError> errors = new ArrayList<>();
        for (ChunkRecord record : selected) {
            if (request.isResume() && (record.getStatus() == ChunkStatus.COMPLETED
                    || record.getStatus() == ChunkStatus.SKIPPED)) {
                log.info("[{}] Chunk {}/{} already {}; not re-read", label,
                        record.getChunkNumber(), records.size(), record.getStatus().getValue());
                resumed++;
                continue;
            }
            processed++;
            ChunkResult result = processChunk(record, request, records.size());
            if (result.error == null) {
                successful++;
                rowsImported += result.outcome.getRowsImported();
                rowsSkipped += result.outcome.getRowsSkipped();
            } else {
                failed++;
                errors.add(result.error);
            }
        }

        Map<ChunkStatus, Integer> counts = countByStatus(ledger.findByTableAndDate(table, date));
        ImportRunSummary summary = ImportRunSummary.builder().table(table).date(date)
                .method(request.getMethod()).totalChunks(records.size()).statusCounts(counts)
                .processedChunks(processed).successfulChunks(successful).failedChunks(failed)
                .resumedChunks(resumed).rowsImported(rowsImported).rowsSkipped(rowsSkipped)
                .elapsed(Duration.between(runStart, clock.instant())).errors(errors).build();
        logSummary(label, summary);
        return summary;
    }

    /**
     * Resets every chunk of a (table, date) pair to pending with cleared counters.
     *
     * @param table table name
     * @param date dataset identifier
     * @return number of chunks reset
     */
    public int resetChunks(String table, String date) {
        int count = ledger.resetAll(table, date, clock.instant());
        log.info("[{}-{}] {} chunks reset to pending", table, date, count);
        return count;
    }

    /**
     * Deletes the ledger rows of a (table, date) pair and optionally their chunk files.
     *
     * @param table table name
     * @param date dataset identifier
     * @param deleteFiles also remove the chunk files and the chunk directory
     * @return number of ledger rows deleted
     */
    public int deleteChunks(String table, String date, boolean deleteFiles) {
        List<ChunkRecord> records = ledger.findByTableAndDate(table, date);
        if (deleteFiles && !records.isEmpty()) {
            int files = ChunkFiles.delete(chunkDirectory(table, date), records);
            log.info("[{}-{}] {} chunk files deleted", table, date, files);
        }
        int count = ledger.deleteAll(table, date);
        log.info("[{}-{}] {} chunk records deleted", table, date, count);
        return count;
    }

    /**
     * Marks pending or failed chunks as skipped so that resumed runs leave them alone.
     *
     * @param table table name
     * @param date dataset identifier
     * @param chunkNumbers chunks to skip
     * @return number of chunks marked skipped
     */
    public int skipChunks(String table, String date, Collection<Integer> chunkNumbers) {
        Instant now = clock.instant();
        int count = 0;
        for (int chunkNumber : new TreeSet<>(chunkNumbers)) {
            if (ledger.markSkipped(table, date, chunkNumber, now)) {
                count++;
            } else {
                log.warn("[{}-{}] Chunk {} not skipped: unknown or not pending/failed", table,
                        date, chunkNumber);
            }
        }
        log.info("[{}-{}] {} chunks marked skipped", table, date, count);
        return count;
    }

    private List<ChunkRecord> select(List<ChunkRecord> records, Set<Integer> chunkNumbers,
            String label) {
        if (chunkNumbers == null || chunkNumbers.isEmpty()) {
            return records;
        }
        Set<Integer> planned = records.stream().map(ChunkRecord::getChunkNumber)
                .collect(Collectors.toSet());
        Set<Integer> unknown = new TreeSet<>(chunkNumbers);
        unknown.removeAll(planned);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException(
                    "Chunks " + unknown + " are not planned for " + label);
        }
        return records.stream().filter(r -> chunkNumbers.contains(r.getChunkNumber()))
                .collect(Collectors.toList());
    }

    private ChunkResult processChunk(ChunkRecord record, ImportRequest request, int total) {
        String table = record.getTableName();
        String date = record.getDatasetDate();
        String label = table + "-" + date;
        int chunkNumber = record.getChunkNumber();
        Path file = chunkDirectory(table, date).resolve(record.getChunkFilename());
        ImportMethod method = request.getMethod();

        log.info("[{}] Chunk {}/{} start: {} ({} rows)", label, chunkNumber, total,
                record.getChunkFilename(), record.getChunkRowCount());

        if (!Files.isRegularFile(file)) {
            Instant now = clock.instant();
            ledger.markProcessing(table, date, chunkNumber, identity.ownerId(),
                    method.getValue(), 0, now);
            String message = truncate("Chunk file not found: " + file);
            ledger.markFailed(table, date, chunkNumber, message, now, 0);
            log.error("[{}] Chunk {} failed: {}", label, chunkNumber, message);
            return ChunkResult.failed(new ChunkError(chunkNumber, message, 1));
        }

        int attempt = 0;
        while (true) {
            Instant start = clock.instant();
            ledger.markProcessing(table, date, chunkNumber, identity.ownerId(), method.getValue(),
                    attempt, start);
            ImportMethod attemptMethod = method;
            try {
                ImportOutcome outcome = runWithDeadline(
                        () -> importOnce(file, table, attemptMethod), chunkNumber);
                Instant end = clock.instant();
                ledger.markCompleted(table, date, chunkNumber, method.getValue(),
                        outcome.getRowsImported(), outcome.getRowsSkipped(), end,
                        Duration.between(start, end).toMillis());
                log.info("[{}] Chunk {}/{} completed: {} rows imported, {} skipped ({} ms)",
                        label, chunkNumber, total, outcome.getRowsImported(),
                        outcome.getRowsSkipped(), Duration.between(start, end).toMillis());
                return ChunkResult.completed(outcome);
            } catch (ChunkImportException e) {
                Instant end = clock.instant();
                String message = truncate(describe(e));
                ledger.markFailed(table, date, chunkNumber, message, end,
                        Duration.between(start, end).toMillis());

                if (e instanceof StrategyIncompatibilityException && method == ImportMethod.BULK
                        && config.isBulkFallbackToStrict()) {
                    log.warn("[{}] Chunk {} rejected by bulk load, falling back to {}: {}", label,
                            chunkNumber, ImportMethod.STRICT.getValue(), e.getMessage());
                    method = ImportMethod.STRICT;
                    continue;
                }
                if (!e.isRetryable() || attempt >= request.getMaxRetries()) {
                    log.error("[{}] Chunk {} failed after {} attempt(s): {}", label, chunkNumber,
                            attempt + 1, message);
                    return ChunkResult.failed(new ChunkError(chunkNumber, message, attempt + 1));
                }
                attempt++;
                log.warn("[{}] Chunk {} failed, retry {}/{}: {}", label, chunkNumber, attempt,
                        request.getMaxRetries(), message);
            }
        }
    }

    private ImportOutcome importOnce(Path file, String table, ImportMethod method) {
        ColumnAlignment alignment = aligner.align(CsvUtils.readHeader(file), readTable(table));
        return strategyFactory.create(method).importChunk(file, table, alignment);
    }

    private TableDefinition readTable(String table) {
        try (Connection conn = dataSource.getConnection()) {
            return dialect.readTable(conn, table);
        } catch (SQLException e) {
            throw new SchemaMismatchException(
                    "Failed to read the columns of table " + table + ": " + e.getMessage(), e);
        }
    }

    /**
     * Runs one strategy call, interrupting it when it exceeds {@code chunk.chunk-timeout}.
     */
    private ImportOutcome runWithDeadline(Callable<ImportOutcome> task, int chunkNumber) {
        Duration timeout = config.getChunkTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            try {
                return task.call();
            } catch (ChunkImportException e) {
                throw e;
            } catch (Exception e) {
                throw new ChunkImportException("Unexpected error: " + e.getMessage(), e);
            }
        }

        ExecutorService executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("chunk-" + chunkNumber + "-worker-%d").setDaemon(true).build());
        Future<ImportOutcome> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            awaitWorker(executor, chunkNumber);
            throw new ChunkTimeoutException(chunkNumber, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ChunkImportException) {
                throw (ChunkImportException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ChunkImportException("Unexpected error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while importing chunk " + chunkNumber,
                    e);
        } finally {
            executor.shutdownNow();
        }
    }

    // the failure is recorded only once the cancelled worker has released its connection
    private static void awaitWorker(ExecutorService executor, int chunkNumber) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker of chunk {} did not stop within {} after cancellation",
                        chunkNumber, CANCEL_GRACE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(
                    "Interrupted while stopping the worker of chunk " + chunkNumber, e);
        }
    }

    private Path chunkDirectory(String table, String date) {
        return ChunkFiles.directory(config.resolveChunkRoot(pathsConfig), table, date);
    }

    private String describe(ChunkImportException e) {
        return e.getClass().getSimpleName() + ": "
                + StringUtils.defaultIfBlank(e.getMessage(), "(no message)");
    }

    private String truncate(String message) {
        return StringUtils.abbreviate(message, Math.max(4, config.getMaxErrorLength()));
    }

    private static Map<ChunkStatus, Integer> countByStatus(List<ChunkRecord> records) {
        Map<ChunkStatus, Integer> counts = new EnumMap<>(ChunkStatus.class);
        for (ChunkStatus status : ChunkStatus.values()) {
            counts.put(status, 0);
        }
        for (ChunkRecord r : records) {
            counts.merge(r.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    private void logSummary(String label, ImportRunSummary s) {
        log.info("=== Import summary: {} ===", label);
        log.info("  method            : {}", s.getMethod().getValue());
        log.info("  chunks            : {} total, {} processed, {} succeeded, {} failed,"
                + " {} resumed", s.getTotalChunks(), s.getProcessedChunks(),
                s.getSuccessfulChunks(), s.getFailedChunks(), s.getResumedChunks());
        log.info("  ledger status     : {}", s.getStatusCounts());
        log.info("  rows              : {} imported, {} skipped", s.getRowsImported(),
                s.getRowsSkipped());
        log.info("  elapsed           : {} ms", s.getElapsed().toMillis());
        for (ChunkError error : s.getErrors()) {
            log.error("  chunk {} failed after {} attempt(s): {}", error.getChunkNumber(),
                    error.getAttempts(), error.getMessage());
        }
        log.info("=== Import {} ===", s.hasFailures() ? "finished with failures" : "finished");
    }

    /**
     * Terminal result of one chunk within a run.
     */
    private static final class ChunkResult {

        private final ImportOutcome outcome;

        private final ChunkError error;

        private ChunkResult(ImportOutcome outcome, ChunkError error) {
            this.outcome = outcome;
            this.error = error;
        }

        static ChunkResult completed(ImportOutcome outcome) {
            return new ChunkResult(outcome, null);
        }

        static ChunkResult failed(ChunkError error) {
            return new ChunkResult(null, error);
        }
    }
}
