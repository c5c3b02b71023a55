/**
 * ChunkLoad: chunked, resumable import of very large CSV extracts into relational databases.
 */
package io.github.yok.chunkload;
