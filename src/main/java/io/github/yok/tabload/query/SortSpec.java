package io.github.yok.tabload.query;

import lombok.NonNull;
import lombok.Value;

/**
 * One {@code ORDER BY} key. The column is checked against the schema when the query is compiled.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SortSpec {

    @NonNull
    String column;

    @NonNull
    SortDirection direction;

    public static SortSpec asc(String column) {
        return new SortSpec(column, SortDirection.ASC);
    }

    public static SortSpec desc(String column) {
        return new SortSpec(column, SortDirection.DESC);
    }
}
