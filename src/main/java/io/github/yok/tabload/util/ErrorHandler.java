package io.github.yok.tabload.util;

import io.github.yok.tabload.exception.TabLoadException;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports a fatal CLI failure and yields the process exit code.
 *
 * <p>
 * The failure is logged with its stack trace through SLF4J and a one-line summary is written to
 * {@code System.err}. The JVM is not terminated here; the caller returns the exit code to Spring
 * Boot. In tests, the current thread can be switched to rethrow instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /**
     * Exit code returned for any core failure.
     */
    public static final int EXIT_FAILURE = 1;

    private static final ThreadLocal<Boolean> RETHROW =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    @Generated
    private ErrorHandler() {}

    /**
     * Makes {@link #errorAndExit(String, Throwable)} rethrow on the current thread.
     */
    public static void rethrowForCurrentThread() {
        RETHROW.set(Boolean.TRUE);
    }

    /**
     * Restores normal reporting on the current thread.
     */
    public static void restoreForCurrentThread() {
        RETHROW.remove();
    }

    /**
     * Logs the failure of a CLI step and returns the exit code to use.
     *
     * @param step CLI step that failed (e.g. {@code load})
     * @param cause failure
     * @return {@link #EXIT_FAILURE}
     * @throws IllegalStateException wrapping {@code cause} when rethrowing is enabled
     */
    public static int errorAndExit(String step, Throwable cause) {
        String operation = cause instanceof TabLoadException
                ? ((TabLoadException) cause).getOperation()
                : "unexpected";
        String message = "Step [" + step + "] failed in operation [" + operation + "]";
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(RETHROW.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
        return EXIT_FAILURE;
    }
}
