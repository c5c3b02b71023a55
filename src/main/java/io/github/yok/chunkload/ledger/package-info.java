/**
 * Durable per-chunk import state ({@code csv_chunk_progress}).
 */
package io.github.yok.chunkload.ledger;
