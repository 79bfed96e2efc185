package io.github.yok.tabload.data;

import com.google.common.base.Preconditions;
import io.github.yok.tabload.schema.ColumnDef;
import io.github.yok.tabload.schema.TableSchema;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;

/**
 * One record of a {@link RowSet}: values in schema column order.
 *
 * <p>
 * Values are coerced to the column types on construction, so a row built from parsed text and a
 * row read back from the database compare equal.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode(of = "values")
public final class Row {

    private final TableSchema schema;

    private final List<Object> values;

    private Row(TableSchema schema, List<Object> values) {
        this.schema = schema;
        this.values = Collections.unmodifiableList(values);
    }

    /**
     * Creates a row, coercing each value to its column type.
     *
     * @param schema schema of the row
     * @param values values in schema column order; {@code null} entries are allowed
     * @return row
     * @throws IllegalArgumentException if the value count does not match the schema
     */
    public static Row of(TableSchema schema, Object... values) {
        Preconditions.checkNotNull(schema, "schema must not be null");
        Preconditions.checkArgument(values.length == schema.size(),
                "expected %s values but got %s", schema.size(), values.length);
        List<ColumnDef> columns = schema.getColumns();
        List<Object> coerced = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            coerced.add(columns.get(i).getType().coerce(values[i]));
        }
        return new Row(schema, coerced);
    }

    /**
     * Returns the schema of this row.
     *
     * @return schema
     */
    public TableSchema getSchema() {
        return schema;
    }

    /**
     * Returns the values in column order.
     *
     * @return unmodifiable value list
     */
    public List<Object> getValues() {
        return values;
    }

    /**
     * Returns a copy of the values as an array, as DBUnit tables expect.
     *
     * @return value array
     */
    public Object[] toArray() {
        return values.toArray();
    }

    /**
     * Returns a column value.
     *
     * @param column column name (case-insensitive)
     * @return value, may be {@code null}
     */
    public Object get(String column) {
        return values.get(schema.indexOf(column));
    }

    /**
     * Returns a text column value.
     *
     * @param column column name
     * @return value, may be {@code null}
     */
    public String getString(String column) {
        Object v = get(column);
        return v == null ? null : v.toString();
    }

    /**
     * Returns an integer column value.
     *
     * @param column column name
     * @return value, may be {@code null}
     */
    public Integer getInt(String column) {
        return (Integer) get(column);
    }

    /**
     * Returns a decimal column value.
     *
     * @param column column name
     * @return value, may be {@code null}
     */
    public BigDecimal getDecimal(String column) {
        return (BigDecimal) get(column);
    }

    /**
     * Returns the row as a column name to value map in schema order.
     *
     * @return map view
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        List<String> names = schema.getColumnNames();
        for (int i = 0; i < names.size(); i++) {
            map.put(names.get(i), values.get(i));
        }
        return map;
    }

    @Override
    public String toString() {
        return Arrays.toString(values.toArray());
    }
}
