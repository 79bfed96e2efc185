package io.github.yok.tabload.query;

import java.util.List;
import lombok.Value;

/**
 * One filter clause of a {@link Criteria}, bound to a declared column.
 *
 * <p>
 * Variants:
 * </p>
 * <ul>
 * <li>{@link Equals}: {@code column = value}, or {@code column IS NULL} for a {@code null}
 * value</li>
 * <li>{@link In}: {@code column IN (v1, v2, ...)} over a non-empty list</li>
 * <li>{@link GreaterThan}: {@code column > value}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public interface Criterion {

    /**
     * Returns the declared (canonical) column name.
     *
     * @return column name
     */
    String getColumn();

    /**
     * Equality predicate.
     */
    @Value
    class Equals implements Criterion {
        String column;
        Object value;
    }

    /**
     * Membership predicate; {@code values} is never empty.
     */
    @Value
    class In implements Criterion {
        String column;
        List<Object> values;
    }

    /**
     * Strict lower bound predicate.
     */
    @Value
    class GreaterThan implements Criterion {
        String column;
        Object value;
    }
}
