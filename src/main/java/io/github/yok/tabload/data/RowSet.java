package io.github.yok.tabload.data;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.github.yok.tabload.schema.TableSchema;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ordered, immutable sequence of rows sharing one schema.
 *
 * <p>
 * Produced by the reader or by a retrieval, consumed once by the sink. Nothing holds on to a row
 * set after it has been loaded.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class RowSet implements Iterable<Row> {

    private final TableSchema schema;

    private final ImmutableList<Row> rows;

    private RowSet(TableSchema schema, List<Row> rows) {
        this.schema = schema;
        this.rows = ImmutableList.copyOf(rows);
    }

    /**
     * Creates a row set.
     *
     * @param schema shared schema
     * @param rows rows in order
     * @return row set
     * @throws IllegalArgumentException if a row has a different schema
     */
    public static RowSet of(TableSchema schema, List<Row> rows) {
        Preconditions.checkNotNull(schema, "schema must not be null");
        for (Row row : rows) {
            Preconditions.checkArgument(schema.equals(row.getSchema()),
                    "row %s does not belong to schema %s", row, schema);
        }
        return new RowSet(schema, rows);
    }

    /**
     * Creates an empty row set.
     *
     * @param schema schema
     * @return empty row set
     */
    public static RowSet empty(TableSchema schema) {
        return new RowSet(schema, ImmutableList.of());
    }

    public TableSchema getSchema() {
        return schema;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Row get(int index) {
        return rows.get(index);
    }

    /**
     * Returns all values of one column in row order.
     *
     * @param column column name
     * @return column values
     */
    public List<Object> column(String column) {
        int idx = schema.indexOf(column);
        return rows.stream().map(r -> r.getValues().get(idx)).collect(Collectors.toList());
    }

    /**
     * Splits the rows into consecutive chunks of at most {@code size} rows, preserving order.
     *
     * @param size chunk size, must be positive
     * @return chunks
     */
    public List<List<Row>> partition(int size) {
        Preconditions.checkArgument(size > 0, "chunk size must be positive: %s", size);
        return Lists.partition(rows, size);
    }

    public Stream<Row> stream() {
        return rows.stream();
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }

    @Override
    public String toString() {
        return "RowSet[rows=" + rows.size() + ", columns=" + schema.getColumnNames() + "]";
    }
}
