package io.github.yok.tabload.exception;

/**
 * Base class of all failures raised by TabLoad components.
 *
 * <p>
 * Every subclass carries the name of the operation that failed so callers (and the CLI log) can
 * tell which step of the pipeline rejected the input.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TabLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Logical operation name (e.g. "load", "compile", "read")
    private final String operation;

    /**
     * Creates an exception without a cause.
     *
     * @param operation failing operation
     * @param message detail message
     */
    public TabLoadException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    /**
     * Creates an exception with a cause.
     *
     * @param operation failing operation
     * @param message detail message
     * @param cause underlying failure
     */
    public TabLoadException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /**
     * Returns the failing operation name.
     *
     * @return operation name
     */
    public String getOperation() {
        return operation;
    }
}
