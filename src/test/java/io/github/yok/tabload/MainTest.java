package io.github.yok.tabload;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.tabload.config.ConfigValidator;
import io.github.yok.tabload.config.SourceConfig;
import io.github.yok.tabload.config.TargetConfig;
import io.github.yok.tabload.config.TargetDescriptorFactory;
import io.github.yok.tabload.db.DataSourceFactory;
import io.github.yok.tabload.db.DbDialectHandlerFactory;
import io.github.yok.tabload.db.DbUnitConfigFactory;
import io.github.yok.tabload.util.ErrorHandler;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    @TempDir
    Path tempDir;

    private SourceConfig sourceConfig;

    private TargetConfig targetConfig;

    private ByteArrayOutputStream out;

    @BeforeEach
    void setup() throws Exception {
        Path csv = tempDir.resolve("employees.csv");
        Files.writeString(csv, "id,name,age,city,occupation,department,level,salary\n"
                + "1,Alice,34,New York,Software Engineer,Engineering,Senior,125000\n"
                + "2,Bob,28,Austin,Data Analyst,Analytics,Mid,85000\n"
                + "3,Carol,45,Chicago,Manager,Engineering,Lead,150000\n"
                + "4,David,23,Austin,Software Engineer,Engineering,Junior,72000\n");

        sourceConfig = new SourceConfig();
        sourceConfig.setFilePath(csv.toString());

        targetConfig = new TargetConfig();
        targetConfig.setType("h2");
        targetConfig.setDatabase(tempDir.resolve("cli").toString());
        targetConfig.setMode("replace");
        targetConfig.setBatchSize(2);

        out = new ByteArrayOutputStream();
    }

    private Main main() {
        Main main = new Main(sourceConfig, targetConfig, new ConfigValidator(),
                new TargetDescriptorFactory(), new DbDialectHandlerFactory(),
                new DbUnitConfigFactory(), new DataSourceFactory());
        main.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        return main;
    }

    private String printed() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void run_正常ケース_引数なしはデフォルトでloadが実行されること() {
        Main main = main();
        main.run();
        assertEquals(0, main.getExitCode());

        Main query = main();
        query.run("-q");
        assertEquals(0, query.getExitCode());
        String text = printed();
        assertTrue(text.contains("# Engineering by salary (desc)"));
        assertTrue(text.contains("id,name,age,city,occupation,department,level,salary"));
        assertTrue(text.indexOf("3,Carol") < text.indexOf("1,Alice"));
        assertTrue(text.indexOf("1,Alice") < text.indexOf("4,David"));
    }

    @Test
    void run_正常ケース_reportで集計結果が出力されること() {
        main().run("--load");
        Main report = main();
        report.run("--report");

        assertEquals(0, report.getExitCode());
        String text = printed();
        assertTrue(text.contains("# Department metrics"));
        assertTrue(text.contains("Engineering,3,115666.67,72000.00,150000.00,347000.00"));
        assertTrue(text.contains("# Salary bands"));
        assertTrue(text.contains("Entry,1,72000.00,72000.00,72000.00"));
        assertTrue(text.contains("High,0,,,"));
        assertTrue(text.contains("# Occupation metrics"));
    }

    @Test
    void run_正常ケース_未知の引数は無視されloadが実行されること() {
        Main main = main();
        main.run("--unknown");
        assertEquals(0, main.getExitCode());
    }

    @Test
    void run_異常ケース_ソースファイルなし_終了コード1となること() {
        sourceConfig.setFilePath(tempDir.resolve("missing.csv").toString());
        Main main = main();
        main.run("-l");
        assertEquals(ErrorHandler.EXIT_FAILURE, main.getExitCode());
    }

    @Test
    void run_異常ケース_未対応のロードモード_終了コード1となること() {
        targetConfig.setMode("overwrite");
        Main main = main();
        main.run();
        assertEquals(ErrorHandler.EXIT_FAILURE, main.getExitCode());
        assertFalse(Files.exists(tempDir.resolve("cli.mv.db")));
    }

    @Test
    void run_異常ケース_再送出有効_失敗した手順名付きで送出されること() {
        targetConfig.setType("oracle");
        ErrorHandler.rethrowForCurrentThread();
        try {
            IllegalStateException ex =
                    assertThrows(IllegalStateException.class, () -> main().run("-r"));
            assertTrue(ex.getMessage().contains("Step [report] failed in operation [config]"));
        } finally {
            ErrorHandler.restoreForCurrentThread();
        }
    }
}
