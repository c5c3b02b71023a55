/**
 * Core of the chunked import: splitting, column alignment, the sequential coordinator, stalled
 * chunk reconciliation and progress queries.
 *
 * <p>
 * {@link io.github.yok.chunkload.core.ChunkSplitter} plans chunks,
 * {@link io.github.yok.chunkload.core.ImportCoordinator} imports them through an
 * {@link io.github.yok.chunkload.core.strategy.ImportStrategy}, and
 * {@link io.github.yok.chunkload.core.ProgressQuery} reports on them.
 * </p>
 */
package io.github.yok.chunkload.core;
