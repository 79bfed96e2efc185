package io.github.yok.tabload.reader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.tabload.config.SourceConfig;
import io.github.yok.tabload.data.Row;
import io.github.yok.tabload.data.RowSet;
import io.github.yok.tabload.exception.SourceReadFailedException;
import io.github.yok.tabload.schema.TableSchema;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TabularReaderTest {

    @TempDir
    Path tempDir;

    private SourceConfig config(Path file) {
        SourceConfig config = new SourceConfig();
        config.setFilePath(file.toString());
        return config;
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void read_正常ケース_ヘッダ付きCSVが型付きで読み込まれること() throws Exception {
        Path file = write("employees.csv",
                "id,name,age,city,occupation,department,level,salary\n"
                        + "1,Alice,34,New York,Software Engineer,Engineering,Senior,125000\n"
                        + "2,\"Smith, Bob\",28,Austin,Analyst,Analytics,Mid,85000.5\n");

        RowSet rows = new TabularReader(config(file), TableSchema.employees()).read();

        assertEquals(2, rows.size());
        Row first = rows.get(0);
        assertEquals(1, first.getInt("id"));
        assertEquals(34, first.getInt("age"));
        assertEquals(new BigDecimal("125000.00"), first.getDecimal("salary"));
        assertEquals("Smith, Bob", rows.get(1).getString("name"));
        assertEquals(new BigDecimal("85000.50"), rows.get(1).getDecimal("salary"));
    }

    @Test
    void read_正常ケース_ヘッダの列順が異なっても宣言順に並ぶこと() throws Exception {
        Path file = write("reordered.csv",
                "SALARY,level,department,occupation,city,age,name,id\n"
                        + "90000,Mid,Sales,Account Executive,Austin,36,Irene,9\n");

        Row row = new TabularReader(config(file), TableSchema.employees()).read().get(0);

        assertEquals(9, row.getInt("id"));
        assertEquals("Irene", row.getString("name"));
        assertEquals(new BigDecimal("90000.00"), row.getDecimal("salary"));
    }

    @Test
    void read_正常ケース_ヘッダなしと区切り文字指定で読み込まれること() throws Exception {
        Path file = write("plain.tsv", "1\tAlice\t\tBoston\tDesigner\tProduct\tJunior\t\n");
        SourceConfig config = config(file);
        config.setDelimiter("\t");
        config.setHeader(false);

        Row row = new TabularReader(config, TableSchema.employees()).read().get(0);

        assertEquals("Alice", row.getString("name"));
        assertNull(row.get("age"));
        assertNull(row.get("salary"));
        assertEquals("Junior", row.getString("level"));
    }

    @Test
    void read_正常ケース_文字コード指定で読み込まれること() throws Exception {
        Path file = tempDir.resolve("sjis.csv");
        Files.writeString(file, "1,山田太郎,40,東京,エンジニア,Engineering,Senior,100000\n",
                Charset.forName("Shift_JIS"));
        SourceConfig config = config(file);
        config.setHeader(false);
        config.setEncoding("Shift_JIS");

        Row row = new TabularReader(config, TableSchema.employees()).read().get(0);

        assertEquals("山田太郎", row.getString("name"));
        assertEquals("東京", row.getString("city"));
    }

    @Test
    void read_正常ケース_ヘッダのみのファイルは空の行集合となること() throws Exception {
        Path file = write("empty.csv", "id,name,age,city,occupation,department,level,salary\n");
        assertTrue(new TabularReader(config(file), TableSchema.employees()).read().isEmpty());
    }

    @Test
    void read_異常ケース_ファイルが存在しない_SourceReadFailedExceptionが送出されること() {
        SourceReadFailedException ex = assertThrows(SourceReadFailedException.class,
                () -> new TabularReader(config(tempDir.resolve("missing.csv")),
                        TableSchema.employees()).read());
        assertEquals("read", ex.getOperation());
        assertTrue(ex.getMessage().contains("missing.csv"));
    }

    @Test
    void read_異常ケース_未宣言のヘッダ列_SourceReadFailedExceptionが送出されること() throws Exception {
        Path file = write("bonus.csv",
                "id,name,age,city,occupation,department,level,salary,bonus\n"
                        + "1,A,1,B,C,D,E,1,2\n");
        SourceReadFailedException ex = assertThrows(SourceReadFailedException.class,
                () -> new TabularReader(config(file), TableSchema.employees()).read());
        assertTrue(ex.getMessage().contains("bonus"));
    }

    @Test
    void read_異常ケース_区切り文字の誤り_列不足として報告されること() throws Exception {
        Path file = write("semicolon.csv",
                "id;name;age;city;occupation;department;level;salary\n1;A;1;B;C;D;E;1\n");
        SourceReadFailedException ex = assertThrows(SourceReadFailedException.class,
                () -> new TabularReader(config(file), TableSchema.employees()).read());
        assertTrue(ex.getMessage().contains("delimiter"));
    }

    @Test
    void read_異常ケース_列数が不一致の行_行番号付きで報告されること() throws Exception {
        Path file = write("short.csv", "id,name,age,city,occupation,department,level,salary\n"
                + "1,A,1,B,C,D,E,1\n" + "2,A,1,B\n");
        SourceReadFailedException ex = assertThrows(SourceReadFailedException.class,
                () -> new TabularReader(config(file), TableSchema.employees()).read());
        assertTrue(ex.getMessage().contains("line 2"), ex.getMessage());
    }

    @Test
    void read_異常ケース_数値列に文字列_列名付きで報告されること() throws Exception {
        Path file = write("badage.csv", "id,name,age,city,occupation,department,level,salary\n"
                + "1,A,thirty,B,C,D,E,1\n");
        SourceReadFailedException ex = assertThrows(SourceReadFailedException.class,
                () -> new TabularReader(config(file), TableSchema.employees()).read());
        assertTrue(ex.getMessage().contains("'age'"), ex.getMessage());
        assertTrue(ex.getCause() instanceof NumberFormatException);
    }
}
