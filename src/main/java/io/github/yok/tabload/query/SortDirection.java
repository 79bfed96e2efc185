package io.github.yok.tabload.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Sort direction and its SQL keyword.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum SortDirection {
    ASC("ASC"), DESC("DESC");

    private final String keyword;

    /**
     * Maps the boolean form used by callers.
     *
     * @param ascending {@code true} for ascending
     * @return direction
     */
    public static SortDirection of(boolean ascending) {
        return ascending ? ASC : DESC;
    }
}
