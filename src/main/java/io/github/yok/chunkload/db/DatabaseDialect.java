package io.github.yok.chunkload.db;

/**
 * Database products supported as import destinations.
 *
 * @author Yasuharu.Okawauchi
 */
public enum DatabaseDialect {

    // PostgreSQL, loaded through COPY FROM STDIN
    POSTGRESQL,

    // H2, loaded through CSVREAD
    H2
}
