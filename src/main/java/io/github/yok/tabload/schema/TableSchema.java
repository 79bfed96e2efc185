package io.github.yok.tabload.schema;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.tabload.exception.UnknownColumnException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Explicitly declared structure of the target table.
 *
 * <p>
 * The schema is the allow-list for every identifier the query builder embeds into SQL text. Column
 * lookup is case-insensitive; the declared (lower-case) name is what ends up in SQL.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode(of = "columns")
@ToString(of = "columns")
public final class TableSchema {

    private static final TableSchema EMPLOYEES = builder()
            .column("id", ColumnType.INTEGER)
            .column("name", ColumnType.VARCHAR)
            .column("age", ColumnType.INTEGER)
            .column("city", ColumnType.VARCHAR)
            .column("occupation", ColumnType.VARCHAR)
            .column("department", ColumnType.VARCHAR)
            .column("level", ColumnType.VARCHAR)
            .column("salary", ColumnType.DECIMAL)
            .build();

    private final List<ColumnDef> columns;

    // lower-case name -> definition
    private final ImmutableMap<String, ColumnDef> byName;

    private TableSchema(List<ColumnDef> columns) {
        this.columns = ImmutableList.copyOf(columns);
        ImmutableMap.Builder<String, ColumnDef> map = ImmutableMap.builder();
        for (ColumnDef def : columns) {
            map.put(def.getName().toLowerCase(Locale.ROOT), def);
        }
        this.byName = map.buildOrThrow();
    }

    /**
     * Returns the employee schema: {@code id, name, age, city, occupation, department, level,
     * salary}.
     *
     * @return employee schema
     */
    public static TableSchema employees() {
        return EMPLOYEES;
    }

    /**
     * Starts a new schema declaration.
     *
     * @return builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the declared columns in order.
     *
     * @return columns
     */
    public List<ColumnDef> getColumns() {
        return columns;
    }

    /**
     * Returns the declared column names in order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDef::getName).collect(Collectors.toList());
    }

    /**
     * Returns the number of columns.
     *
     * @return column count
     */
    public int size() {
        return columns.size();
    }

    /**
     * Returns the zero-based position of a column.
     *
     * @param name column name (case-insensitive)
     * @return position
     * @throws UnknownColumnException if the column is not declared
     */
    public int indexOf(String name) {
        return columns.indexOf(require(name));
    }

    /**
     * Looks up a column.
     *
     * @param name column name (case-insensitive), may be {@code null}
     * @return definition, or empty if not declared
     */
    public Optional<ColumnDef> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Looks up a column that must exist.
     *
     * @param name column name (case-insensitive)
     * @return definition
     * @throws UnknownColumnException if the column is not declared
     */
    public ColumnDef require(String name) {
        return find(name).orElseThrow(() -> new UnknownColumnException(name, getColumnNames()));
    }

    /**
     * Renders the column list of a {@code CREATE TABLE} statement.
     *
     * @return e.g. {@code id INTEGER, name VARCHAR(255)}
     */
    public String toColumnDeclarations() {
        return columns.stream().map(c -> c.getName() + " " + c.getType().getSqlType())
                .collect(Collectors.joining(", "));
    }

    /**
     * Builder for {@link TableSchema}.
     */
    public static final class Builder {

        private final ImmutableList.Builder<ColumnDef> columns = ImmutableList.builder();

        private Builder() {}

        /**
         * Appends a column.
         *
         * @param name column name; stored lower-case
         * @param type semantic type
         * @return this builder
         */
        public Builder column(String name, ColumnType type) {
            Preconditions.checkArgument(name != null && !name.isBlank(),
                    "column name must not be blank");
            Preconditions.checkNotNull(type, "column type must not be null");
            columns.add(new ColumnDef(name.trim().toLowerCase(Locale.ROOT), type));
            return this;
        }

        /**
         * Builds the schema.
         *
         * @return schema
         * @throws IllegalArgumentException if no column was declared or names repeat
         */
        public TableSchema build() {
            List<ColumnDef> list = columns.build();
            Preconditions.checkArgument(!list.isEmpty(), "schema must declare at least one column");
            return new TableSchema(list);
        }
    }
}
