/**
 * Error taxonomy of the chunk import engine.
 *
 * <p>
 * Row-level errors ({@link io.github.yok.chunkload.exception.RowCoercionException}) never abort a
 * chunk, chunk-level errors never abort a run. Ledger access errors are not part of this hierarchy:
 * they surface as Spring {@code DataAccessException} and abort the run.
 * </p>
 */
package io.github.yok.chunkload.exception;
