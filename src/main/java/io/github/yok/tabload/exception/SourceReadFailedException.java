package io.github.yok.tabload.exception;

/**
 * Raised when the delimited source file cannot be read or does not match the declared schema.
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceReadFailedException extends TabLoadException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param filePath source file path
     * @param reason failure detail
     */
    public SourceReadFailedException(String filePath, String reason) {
        super("read", "Failed to read source file [" + filePath + "]: " + reason);
    }

    /**
     * Creates the exception with a cause.
     *
     * @param filePath source file path
     * @param reason failure detail
     * @param cause underlying failure
     */
    public SourceReadFailedException(String filePath, String reason, Throwable cause) {
        super("read", "Failed to read source file [" + filePath + "]: " + reason, cause);
    }
}
