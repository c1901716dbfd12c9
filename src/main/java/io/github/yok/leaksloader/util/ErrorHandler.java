package io.github.yok.leaksloader.util;

import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal error of the ingestion run.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Logs the error and its stack trace using SLF4J.</li>
 * <li>Writes {@code ERROR: <message>} and the root cause to {@code System.err}.</li>
 * <li>Does not terminate the JVM; the caller turns the returned code into the process exit
 * code.</li>
 * <li>In tests, callers can switch behavior to throwing an exception via a thread-local
 * flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /**
     * Process exit code for a run terminated by a fatal error.
     */
    public static final int FATAL_EXIT_CODE = 1;

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    @Generated
    private ErrorHandler() {}

    /**
     * Switch to "throw exception instead of reporting an exit code" for the current thread (useful
     * for tests).
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
     * Logs the message with the cause's stack trace and prints a concise message to
     * {@code System.err}.
     *
     * @param message message identifying what failed (table, file or credential)
     * @param cause failure
     * @return {@link #FATAL_EXIT_CODE}
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static int errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
        return FATAL_EXIT_CODE;
    }

    /**
     * Logs the message at error level and prints it to {@code System.err}.
     *
     * @param message message to report
     * @return {@link #FATAL_EXIT_CODE}
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static int errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
        return FATAL_EXIT_CODE;
    }
}
