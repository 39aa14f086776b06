package io.github.yok.issuesync.util;

import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs errors and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Intended for the CLI commands, where fatal errors abort the command and best-effort failures
 * only leave a warning line behind.
 * </p>
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>{@link #fatal(String, Throwable)} logs the full stack trace via SLF4J, writes
 * {@code ERROR: ...} to {@code System.err} and returns an exception for the caller to throw.</li>
 * <li>{@link #warn(String)} writes {@code Warning: ...} to {@code System.err}.</li>
 * <li>Neither method terminates the JVM by itself.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ErrorHandler() {
        throw new AssertionError("No io.github.yok.issuesync.util.ErrorHandler instances for you!");
    }

    /**
     * Logs the given message and root cause at error level, prints a concise message to
     * {@code System.err}, and returns an exception wrapping the cause.
     *
     * <pre>
     * throw ErrorHandler.fatal("Schema bring-up failed", e);
     * </pre>
     *
     * @param message message to log
     * @param cause root cause
     * @return exception to be thrown by the caller
     */
    public static IllegalStateException fatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        System.err.println("ERROR: " + message + "\n" + cause.getMessage());
        return new IllegalStateException(message, cause);
    }

    /**
     * Prints a warning line to {@code System.err}.
     *
     * @param message warning text, without the {@code Warning: } prefix
     */
    public static void warn(String message) {
        System.err.println("Warning: " + message);
    }

    /**
     * Prints an informational line to {@code System.err}.
     *
     * @param message message text
     */
    public static void info(String message) {
        System.err.println(message);
    }
}
