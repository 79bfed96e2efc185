package io.github.yok.tabload.exception;

/**
 * Raised when a load mode other than {@code append} or {@code replace} is requested.
 *
 * @author Yasuharu.Okawauchi
 */
public class UnsupportedModeException extends TabLoadException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param mode rejected mode value
     */
    public UnsupportedModeException(String mode) {
        super("load", "Unsupported load mode [" + mode + "]; expected one of [append, replace]");
    }
}
