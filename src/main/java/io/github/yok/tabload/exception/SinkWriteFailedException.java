package io.github.yok.tabload.exception;

/**
 * Raised when the relational backend rejects a connection, DDL or insert.
 *
 * <p>
 * The message carries the backend diagnostic. Rows committed by earlier batches are not rolled
 * back.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SinkWriteFailedException extends TabLoadException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param table target table
     * @param reason failure detail
     */
    public SinkWriteFailedException(String table, String reason) {
        super("load", "Write to table [" + table + "] failed: " + reason);
    }

    /**
     * Creates the exception with a backend cause.
     *
     * @param table target table
     * @param reason failure detail
     * @param cause backend failure
     */
    public SinkWriteFailedException(String table, String reason, Throwable cause) {
        super("load", "Write to table [" + table + "] failed: " + reason + ": "
                + cause.getMessage(), cause);
    }
}
