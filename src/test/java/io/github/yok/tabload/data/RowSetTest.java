package io.github.yok.tabload.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.tabload.schema.ColumnType;
import io.github.yok.tabload.schema.TableSchema;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RowSetTest {

    private final TableSchema schema = TableSchema.employees();

    private Row employee(int id, String department, String salary) {
        return Row.of(schema, id, "name" + id, 30, "Austin", "Engineer", department, "Mid",
                salary);
    }

    @Test
    void of_正常ケース_値が列型に変換されること() {
        Row row = employee(1, "Engineering", "85000");
        assertEquals(1, row.getInt("id"));
        assertEquals("Engineering", row.getString("DEPARTMENT"));
        assertEquals(new BigDecimal("85000.00"), row.getDecimal("salary"));
        assertEquals("Engineering", row.toMap().get("department"));
    }

    @Test
    void of_異常ケース_値の数が列数と異なる_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> Row.of(schema, 1, "a"));
    }

    @Test
    void of_異常ケース_別スキーマの行を含む_IllegalArgumentExceptionが送出されること() {
        TableSchema other = TableSchema.builder().column("id", ColumnType.INTEGER).build();
        List<Row> rows = List.of(Row.of(other, 1));
        assertThrows(IllegalArgumentException.class, () -> RowSet.of(schema, rows));
    }

    @Test
    void column_正常ケース_行順で列値が返ること() {
        RowSet rows = RowSet.of(schema, List.of(employee(1, "Sales", "1"),
                employee(2, "Product", null), employee(3, "Sales", "3")));
        List<Object> salaries = rows.column("salary");
        assertEquals(new BigDecimal("1.00"), salaries.get(0));
        assertNull(salaries.get(1));
        assertEquals(List.of("Sales", "Product", "Sales"), rows.column("department"));
    }

    @Test
    void partition_正常ケース_順序を保ってバッチ分割されること() {
        List<Row> list = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            list.add(employee(i, "Sales", "100"));
        }
        RowSet rows = RowSet.of(schema, list);

        List<List<Row>> chunks = rows.partition(2);
        assertEquals(3, chunks.size());
        assertEquals(2, chunks.get(0).size());
        assertEquals(1, chunks.get(2).size());
        assertEquals(5, chunks.get(2).get(0).getInt("id"));

        assertEquals(1, rows.partition(10).size());
        assertThrows(IllegalArgumentException.class, () -> rows.partition(0));
    }

    @Test
    void empty_正常ケース_空の行集合が返ること() {
        RowSet rows = RowSet.empty(schema);
        assertTrue(rows.isEmpty());
        assertEquals(0, rows.size());
        assertEquals(schema, rows.getSchema());
    }
}
