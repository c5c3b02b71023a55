/**
 * Shared helpers: CSV I/O, CLI error reporting, process identity and log rendering.
 */
package io.github.yok.chunkload.util;
