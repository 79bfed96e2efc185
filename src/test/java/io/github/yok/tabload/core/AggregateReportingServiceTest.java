package io.github.yok.tabload.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.tabload.config.BackendType;
import io.github.yok.tabload.config.LoadMode;
import io.github.yok.tabload.config.TargetDescriptor;
import io.github.yok.tabload.data.Row;
import io.github.yok.tabload.data.RowSet;
import io.github.yok.tabload.db.DataSourceFactory;
import io.github.yok.tabload.db.DbUnitConfigFactory;
import io.github.yok.tabload.db.H2DialectHandler;
import io.github.yok.tabload.report.DepartmentLevelMetrics;
import io.github.yok.tabload.report.DepartmentMetrics;
import io.github.yok.tabload.report.LevelMetrics;
import io.github.yok.tabload.report.OccupationMetrics;
import io.github.yok.tabload.report.SalaryBand;
import io.github.yok.tabload.report.SalaryBandMetrics;
import io.github.yok.tabload.schema.TableSchema;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AggregateReportingServiceTest {

    @TempDir
    Path tempDir;

    private final TableSchema schema = TableSchema.employees();

    private TargetDescriptor target;

    private DataSource dataSource;

    @BeforeEach
    void setup() {
        target = TargetDescriptor.builder().backendType(BackendType.H2)
                .url("jdbc:h2:file:" + tempDir.resolve("report").toAbsolutePath()).user("sa")
                .password("").table("employees").mode(LoadMode.REPLACE).build();
        dataSource = new DataSourceFactory().create(target);
    }

    private AggregateReportingService seed(String[][] employees) {
        List<Row> rows = new ArrayList<>();
        int id = 1;
        for (String[] e : employees) {
            // department, level, occupation, salary
            rows.add(Row.of(schema, id, "Employee " + id, 30, "Austin", e[2], e[0], e[1], e[3]));
            id++;
        }
        new RelationalSink(target, schema, dataSource, new H2DialectHandler(),
                new DbUnitConfigFactory()).load(RowSet.of(schema, rows));
        return new AggregateReportingService("employees", dataSource);
    }

    private AggregateReportingService seedDefault() {
        return seed(new String[][] {
                {"Engineering", "Senior", "Engineer", "125000"},
                {"Engineering", "Junior", "Engineer", "75000"},
                {"Sales", "Mid", "Rep", "90000"},
                {"Sales", "Senior", "Rep", "115000"},
                {"Product", "Senior", "PM", "120000"}});
    }

    private AggregateReportingService seedSalaries(String... salaries) {
        String[][] employees = new String[salaries.length][];
        for (int i = 0; i < salaries.length; i++) {
            employees[i] = new String[] {"Engineering", "Mid", "Engineer", salaries[i]};
        }
        return seed(employees);
    }

    private static BigDecimal dec(String value) {
        return new BigDecimal(value);
    }

    @Test
    void departmentMetrics_正常ケース_総支給額の降順で統計が返ること() {
        List<DepartmentMetrics> metrics = seedDefault().departmentMetrics();

        assertEquals(List.of("Sales", "Engineering", "Product"), metrics.stream()
                .map(DepartmentMetrics::getDepartment).collect(Collectors.toList()));
        DepartmentMetrics sales = metrics.get(0);
        assertEquals(2, sales.getEmployeeCount());
        assertEquals(dec("102500.00"), sales.getAverageSalary());
        assertEquals(dec("90000.00"), sales.getMinSalary());
        assertEquals(dec("115000.00"), sales.getMaxSalary());
        assertEquals(dec("205000.00"), sales.getTotalPayroll());
    }

    @Test
    void levelMetrics_正常ケース_平均給与の降順で統計が返ること() {
        List<LevelMetrics> metrics = seedDefault().levelMetrics();

        assertEquals(List.of("Senior", "Mid", "Junior"),
                metrics.stream().map(LevelMetrics::getLevel).collect(Collectors.toList()));
        LevelMetrics senior = metrics.get(0);
        assertEquals(3, senior.getEmployeeCount());
        assertEquals(dec("120000.00"), senior.getAverageSalary());
        assertEquals(dec("360000.00"), senior.getTotalPayroll());
    }

    @Test
    void departmentLevelDistribution_正常ケース_部署昇順かつ平均給与降順で返ること() {
        List<DepartmentLevelMetrics> metrics = seedDefault().departmentLevelDistribution();

        assertEquals(List.of("Engineering/Senior", "Engineering/Junior", "Product/Senior",
                "Sales/Senior", "Sales/Mid"),
                metrics.stream().map(m -> m.getDepartment() + "/" + m.getLevel())
                        .collect(Collectors.toList()));
        assertEquals(1, metrics.get(0).getEmployeeCount());
        assertEquals(dec("125000.00"), metrics.get(0).getAverageSalary());
    }

    @Test
    void occupationMetrics_正常ケース_平均給与の降順で統計が返ること() {
        List<OccupationMetrics> metrics = seedDefault().occupationMetrics();

        assertEquals(List.of("PM", "Rep", "Engineer"), metrics.stream()
                .map(OccupationMetrics::getOccupation).collect(Collectors.toList()));
        assertEquals(dec("75000.00"), metrics.get(2).getMinSalary());
    }

    @Test
    void salaryBands_正常ケース_4区分すべてが昇順で返り空区分は件数0となること() {
        List<SalaryBandMetrics> bands =
                seedSalaries("85000", "120000", "95000", "80000").salaryBands();

        assertEquals(List.of(SalaryBand.values()), bands.stream().map(SalaryBandMetrics::getBand)
                .collect(Collectors.toList()));

        SalaryBandMetrics entry = bands.get(0);
        assertEquals(0, entry.getEmployeeCount());
        assertNull(entry.getAverageSalary());

        SalaryBandMetrics medium = bands.get(1);
        assertEquals(3, medium.getEmployeeCount());
        assertEquals(dec("86666.67"), medium.getAverageSalary());
        assertEquals(dec("80000.00"), medium.getMinSalary());
        assertEquals(dec("95000.00"), medium.getMaxSalary());

        assertEquals(0, bands.get(2).getEmployeeCount());
        assertEquals(1, bands.get(3).getEmployeeCount());
        assertEquals(dec("120000.00"), bands.get(3).getMinSalary());
    }

    @Test
    void salaryBands_正常ケース_境界値は下限側の区分に含まれること() {
        List<SalaryBandMetrics> bands = seedSalaries("79999.99", "80000", "99999.99", "100000",
                "119999.99", "120000").salaryBands();

        assertEquals(List.of(1L, 2L, 2L, 1L), bands.stream()
                .map(SalaryBandMetrics::getEmployeeCount).collect(Collectors.toList()));
        assertEquals(dec("80000.00"), bands.get(1).getMinSalary());
        assertEquals(dec("100000.00"), bands.get(2).getMinSalary());
    }

    @Test
    void salaryBands_正常ケース_件数の合計がテーブル行数と一致すること() {
        AggregateReportingService service = seedDefault();

        long total = service.salaryBands().stream().mapToLong(SalaryBandMetrics::getEmployeeCount)
                .sum();
        long departments = service.departmentMetrics().stream()
                .mapToLong(DepartmentMetrics::getEmployeeCount).sum();

        assertEquals(5, total);
        assertEquals(5, departments);
    }

    @Test
    void reports_正常ケース_空テーブルでは空一覧と件数0の区分が返ること() {
        AggregateReportingService service = seed(new String[0][]);

        assertTrue(service.departmentMetrics().isEmpty());
        assertTrue(service.levelMetrics().isEmpty());
        List<SalaryBandMetrics> bands = service.salaryBands();
        assertEquals(4, bands.size());
        assertTrue(bands.stream().allMatch(b -> b.getEmployeeCount() == 0));
    }
}
