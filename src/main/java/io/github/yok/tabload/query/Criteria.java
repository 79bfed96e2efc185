package io.github.yok.tabload.query;

import com.google.common.collect.ImmutableList;
import io.github.yok.tabload.exception.EmptyCriteriaValueException;
import io.github.yok.tabload.exception.UnknownColumnException;
import io.github.yok.tabload.schema.ColumnDef;
import io.github.yok.tabload.schema.TableSchema;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated set of filter clauses, at most one per column, kept in insertion order.
 *
 * <p>
 * Columns are checked against the schema and values are converted to the column type when a clause
 * is added, so an invalid criteria object can never be constructed. Adding a second clause for the
 * same column replaces the first. An empty criteria selects every row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class Criteria {

    private final TableSchema schema;

    private final List<Criterion> criteria;

    private Criteria(TableSchema schema, Collection<Criterion> criteria) {
        this.schema = schema;
        this.criteria = ImmutableList.copyOf(criteria);
    }

    /**
     * Starts a new criteria for the given schema.
     *
     * @param schema allow-list of columns
     * @return builder
     */
    public static Builder builder(TableSchema schema) {
        return new Builder(schema);
    }

    /**
     * Returns a criteria without clauses.
     *
     * @param schema schema
     * @return empty criteria
     */
    public static Criteria none(TableSchema schema) {
        return new Criteria(schema, Collections.emptyList());
    }

    /**
     * Builds criteria from the dictionary form: a collection or array value becomes a membership
     * clause, any other value an equality clause.
     *
     * @param schema allow-list of columns
     * @param filters column to value(s)
     * @return criteria
     * @throws UnknownColumnException if a key is not a declared column
     * @throws EmptyCriteriaValueException if a collection value is empty
     */
    public static Criteria fromMap(TableSchema schema, Map<String, ?> filters) {
        Builder builder = builder(schema);
        for (Map.Entry<String, ?> e : filters.entrySet()) {
            Object value = e.getValue();
            if (value instanceof Collection) {
                builder.in(e.getKey(), (Collection<?>) value);
            } else if (value instanceof Object[]) {
                builder.in(e.getKey(), Arrays.asList((Object[]) value));
            } else {
                builder.equalTo(e.getKey(), value);
            }
        }
        return builder.build();
    }

    public TableSchema getSchema() {
        return schema;
    }

    public List<Criterion> getCriteria() {
        return criteria;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    @Override
    public String toString() {
        return "Criteria" + criteria;
    }

    /**
     * Builder for {@link Criteria}.
     */
    public static final class Builder {

        private final TableSchema schema;

        // canonical column -> clause
        private final Map<String, Criterion> clauses = new LinkedHashMap<>();

        private Builder(TableSchema schema) {
            this.schema = schema;
        }

        /**
         * Adds {@code column = value}.
         *
         * @param column column name (case-insensitive)
         * @param value value; {@code null} matches SQL NULL
         * @return this builder
         * @throws UnknownColumnException if the column is not declared
         */
        public Builder equalTo(String column, Object value) {
            ColumnDef def = schema.require(column);
            clauses.put(def.getName(),
                    new Criterion.Equals(def.getName(), def.getType().bind(value)));
            return this;
        }

        /**
         * Adds {@code column IN (values)}.
         *
         * @param column column name (case-insensitive)
         * @param values accepted values, in order; must not be empty
         * @return this builder
         * @throws UnknownColumnException if the column is not declared
         * @throws EmptyCriteriaValueException if {@code values} is empty
         */
        public Builder in(String column, Collection<?> values) {
            ColumnDef def = schema.require(column);
            if (values == null || values.isEmpty()) {
                throw new EmptyCriteriaValueException(def.getName());
            }
            List<Object> bound = new ArrayList<>(values.size());
            for (Object v : values) {
                bound.add(def.getType().bind(v));
            }
            clauses.put(def.getName(),
                    new Criterion.In(def.getName(), Collections.unmodifiableList(bound)));
            return this;
        }

        /**
         * Adds {@code column > value}.
         *
         * @param column column name (case-insensitive)
         * @param value exclusive lower bound, not {@code null}
         * @return this builder
         * @throws UnknownColumnException if the column is not declared
         */
        public Builder greaterThan(String column, Object value) {
            ColumnDef def = schema.require(column);
            if (value == null) {
                throw new IllegalArgumentException(
                        "lower bound for column [" + def.getName() + "] must not be null");
            }
            clauses.put(def.getName(),
                    new Criterion.GreaterThan(def.getName(), def.getType().bind(value)));
            return this;
        }

        public Criteria build() {
            return new Criteria(schema, clauses.values());
        }
    }
}
