/**
 * Database dialects: metadata lookup, conflict-ignoring inserts, DBUnit type factories and native
 * bulk loading for PostgreSQL and H2.
 */
package io.github.yok.chunkload.db;
