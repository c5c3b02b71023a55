package io.github.yok.chunkload.core;

import io.github.yok.chunkload.config.ChunkLoadConfig;
import io.github.yok.chunkload.ledger.ChunkLedger;
import io.github.yok.chunkload.ledger.ChunkRecord;
import io.github.yok.chunkload.ledger.ChunkStatus;
import io.github.yok.chunkload.util.ProcessIdentity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Requeues chunks left in {@code processing} by a run that no longer exists.
 *
 * <p>
 * A chunk owned by a process on this host is requeued once that process is gone. A chunk owned by
 * another host is requeued once its record has not been updated for {@code chunk.stale-after}.
 * A chunk whose owner is still active keeps its state and blocks a new run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChunkReconciler {

    private final ChunkLedger ledger;

    private final ProcessIdentity identity;

    private final ChunkLoadConfig config;

    private final Clock clock;

    /**
     * Reconciles the processing chunks of a (table, date) pair.
     *
     * @param table table name
     * @param date dataset identifier
     * @return number of chunks requeued
     * @throws IllegalStateException if a chunk is owned by a run that is still active
     */
    public int reconcile(String table, String date) {
        Instant now = clock.instant();
        int requeued = 0;
        List<String> active = new ArrayList<>();
        for (ChunkRecord r : ledger.findByTableAndDate(table, date)) {
            if (r.getStatus() != ChunkStatus.PROCESSING) {
                continue;
            }
            String reason = staleReason(r, now);
            if (reason == null) {
                active.add("chunk " + r.getChunkNumber() + " (" + r.getOwnerId() + ")");
                continue;
            }
            if (ledger.requeue(table, date, r.getChunkNumber(), reason, now)) {
                log.warn("[{}-{}] Chunk {} requeued: {}", table, date, r.getChunkNumber(),
                        reason);
                requeued++;
            }
        }
        if (!active.isEmpty()) {
            throw new IllegalStateException("Another import run is active for " + table + "-"
                    + date + ": " + String.join(", ", active));
        }
        return requeued;
    }

    /**
     * Returns why a processing chunk is abandoned, or {@code null} while its owner is active.
     */
    private String staleReason(ChunkRecord r, Instant now) {
        String owner = r.getOwnerId();
        if (owner == null || owner.isBlank()) {
            return "Requeued: processing without a recorded owner";
        }
        if (identity.isLocal(owner)) {
            if (identity.isAlive(owner)) {
                return null;
            }
            return "Requeued: owner process " + owner + " is no longer running";
        }
        Instant lastUpdate = r.getUpdatedAt() != null ? r.getUpdatedAt() : r.getStartedAt();
        if (lastUpdate == null) {
            return "Requeued: owner " + owner + " left no timestamp";
        }
        Duration silence = Duration.between(lastUpdate, now);
        if (silence.compareTo(config.getStaleAfter()) >= 0) {
            return "Requeued: owner " + owner + " silent for " + silence;
        }
        return null;
    }
}
