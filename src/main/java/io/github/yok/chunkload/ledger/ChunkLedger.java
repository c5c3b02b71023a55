package io.github.yok.chunkload.ledger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of per-chunk import state.
 *
 * <p>
 * Every mutation is a single statement; callers rely on per-statement atomicity and never hold a
 * transaction across a chunk import. Ledger failures surface as Spring
 * {@link org.springframework.dao.DataAccessException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface ChunkLedger {

    /**
     * Inserts planned chunks in one batch.
     *
     * @param records records to insert, all in {@link ChunkStatus#PENDING}
     * @param now creation time
     */
    void insertAll(List<ChunkRecord> records, Instant now);

    /**
     * Returns all records of a (table, date) pair ordered by chunk number.
     *
     * @param table table name
     * @param date dataset identifier
     * @return records, empty when nothing is planned
     */
    List<ChunkRecord> findByTableAndDate(String table, String date);

    /**
     * Finds a single record.
     *
     * @param table table name
     * @param date dataset identifier
     * @param chunkNumber chunk number
     * @return the record if present
     */
    Optional<ChunkRecord> find(String table, String date, int chunkNumber);

    /**
     * Moves a chunk into {@link ChunkStatus#PROCESSING} for one attempt.
     *
     * @param table table name
     * @param date dataset identifier
     * @param chunkNumber chunk number
     * @param ownerId {@code pid@host} of the running process
     * @param method import method name
     * @param retryCount retry number of this attempt, 0 for the first one
     * @param startedAt attempt start
     */
    void markProcessing(String table, String date, int chunkNumber, String ownerId, String method,
            int retryCount, Instant startedAt);

    /**
     * Records a successful attempt.
     *
     * @param table table name
     * @param date dataset identifier
     * @param chunkNumber chunk number
     * @param method import method that produced the counts
     * @param rowsImported accepted rows
     * @param rowsSkipped rejected rows
     * @param completedAt completion time
     * @param durationMs attempt duration in milliseconds
     */
    void markCompleted(String table, String date, int chunkNumber, String method,
            long rowsImported, long rowsSkipped, Instant completedAt, long durationMs);

    /**
     * Records a failed attempt.
     *
     * @param table table name
     * @param date dataset identifier
     * @param chunkNumber chunk number
     * @param errorMessage truncated error message
     * @param completedAt failure time
     * @param durationMs attempt duration in milliseconds
     */
    void markFailed(String table, String date, int chunkNumber, String errorMessage,
            Instant completedAt, long durationMs);

    /**
     * Marks a pending or failed chunk as skipped.
     *
     * @param table table name
     * @param date dataset identifier
     * @param chunkNumber chunk number
     * @param now update time
     * @return {@code true} if the chunk was updated
     */
    boolean markSkipped(String table, String date, int chunkNumber, Instant now);

    /**
     * Moves a processing chunk back to pending.
     *
     * @param table table name
     * @param date dataset identifier
     * @param chunkNumber chunk number
     * @param reason message stored as the error message
     * @param now update time
     * @return {@code true} if the chunk was still processing and got requeued
     */
    boolean requeue(String table, String date, int chunkNumber, String reason, Instant now);

    /**
     * Resets every record of a (table, date) pair to pending with cleared counters.
     *
     * @param table table name
     * @param date dataset identifier
     * @param now update time
     * @return number of records reset
     */
    int resetAll(String table, String date, Instant now);

    /**
     * Replaces every record of a (table, date) pair with a new plan in one transaction. Either the
     * previous records stay untouched or the new ones are all in place.
     *
     * @param table table name
     * @param date dataset identifier
     * @param records new records, all in {@link ChunkStatus#PENDING}
     * @param now creation time
     * @return number of previous records deleted
     */
    int replaceAll(String table, String date, List<ChunkRecord> records, Instant now);

    /**
     * Deletes every record of a (table, date) pair.
     *
     * @param table table name
     * @param date dataset identifier
     * @return number of records deleted
     */
    int deleteAll(String table, String date);
}
