package io.github.yok.chunkload.util;

import io.github.yok.chunkload.exception.ChunkImportException;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal command error and echoes a concise message to
 * {@code System.err}.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error using SLF4J, with the stack trace when a cause is given.</li>
 * <li>Writes one line to {@code System.err}; chunk import errors are prefixed with their type so
 * that operators can tell a schema problem from an I/O problem at a glance.</li>
 * <li>Does not terminate the JVM by itself; the command line runner turns the failure into exit
 * status 1.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via thread-local flags.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    @Generated
    private ErrorHandler() {
        throw new AssertionError("No ErrorHandler instances for you!");
    }

    /**
     * Switch to "throw exception instead of ending the process" for the current thread (useful for
     * tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the given message and cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause failure that ended the command
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + describe(cause));
    }

    /**
     * Logs the given message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }

    /**
     * Renders a cause for the console.
     *
     * @param cause failure
     * @return {@code SimpleName: message} for chunk import errors, otherwise the root cause
     *         message
     */
    static String describe(Throwable cause) {
        if (cause instanceof ChunkImportException) {
            return cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
        return ExceptionUtils.getRootCauseMessage(cause);
    }
}
