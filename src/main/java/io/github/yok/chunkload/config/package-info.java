/**
 * Spring Boot configuration bindings ({@code data-path} and the {@code chunk.*} section).
 */
package io.github.yok.chunkload.config;
