package io.github.yok.tabload.exception;

import java.util.Collection;

/**
 * Raised when a criteria or sort column is not part of the target table schema.
 *
 * @author Yasuharu.Okawauchi
 */
public class UnknownColumnException extends TabLoadException {

    private static final long serialVersionUID = 1L;

    private final String column;

    /**
     * Creates the exception.
     *
     * @param column rejected column name
     * @param knownColumns columns accepted by the schema
     */
    public UnknownColumnException(String column, Collection<String> knownColumns) {
        super("compile", "Unknown column [" + column + "]; known columns: " + knownColumns);
        this.column = column;
    }

    /**
     * Returns the rejected column name.
     *
     * @return column name as supplied by the caller
     */
    public String getColumn() {
        return column;
    }
}
