package io.github.yok.chunkload.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Overall state of a (table, date) import derived from its chunk states.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum OverallStatus {

    // No chunk planned
    NOT_STARTED("not_started"),

    // Planned, nothing completed
    PENDING("pending"),

    // Some chunks completed, others pending
    IN_PROGRESS("in_progress"),

    // A chunk is being imported
    PROCESSING("processing"),

    // At least one chunk failed
    FAILED("failed"),

    // Every chunk completed or skipped
    COMPLETED("completed");

    private final String value;
}
