/**
 * Interchangeable chunk loading strategies: strict parser, permissive parser and native bulk load.
 */
package io.github.yok.chunkload.core.strategy;
