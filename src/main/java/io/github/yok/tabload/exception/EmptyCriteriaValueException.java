package io.github.yok.tabload.exception;

/**
 * Raised when a membership criterion is given an empty value list.
 *
 * @author Yasuharu.Okawauchi
 */
public class EmptyCriteriaValueException extends TabLoadException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param column column whose value list was empty
     */
    public EmptyCriteriaValueException(String column) {
        super("compile", "Membership criterion for column [" + column + "] has no values");
    }
}
