package io.github.yok.tabload.exception;

/**
 * Raised when a required configuration field is missing or malformed.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigInvalidException extends TabLoadException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param field offending configuration key (e.g. {@code target.table})
     * @param reason why the value was rejected
     */
    public ConfigInvalidException(String field, String reason) {
        super("config", "Invalid configuration [" + field + "]: " + reason);
    }
}
