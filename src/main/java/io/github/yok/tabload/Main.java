package io.github.yok.tabload;

import io.github.yok.tabload.config.BackendType;
import io.github.yok.tabload.config.ConfigValidator;
import io.github.yok.tabload.config.SourceConfig;
import io.github.yok.tabload.config.TargetConfig;
import io.github.yok.tabload.config.TargetDescriptor;
import io.github.yok.tabload.config.TargetDescriptorFactory;
import io.github.yok.tabload.core.AggregateReportingService;
import io.github.yok.tabload.core.LoadResult;
import io.github.yok.tabload.core.RelationalSink;
import io.github.yok.tabload.core.RetrievalService;
import io.github.yok.tabload.data.Row;
import io.github.yok.tabload.data.RowSet;
import io.github.yok.tabload.db.DataSourceFactory;
import io.github.yok.tabload.db.DbDialectHandler;
import io.github.yok.tabload.db.DbDialectHandlerFactory;
import io.github.yok.tabload.db.DbUnitConfigFactory;
import io.github.yok.tabload.query.SortSpec;
import io.github.yok.tabload.reader.TabularReader;
import io.github.yok.tabload.report.DepartmentLevelMetrics;
import io.github.yok.tabload.report.DepartmentMetrics;
import io.github.yok.tabload.report.LevelMetrics;
import io.github.yok.tabload.report.OccupationMetrics;
import io.github.yok.tabload.report.SalaryBandMetrics;
import io.github.yok.tabload.schema.TableSchema;
import io.github.yok.tabload.util.CsvUtils;
import io.github.yok.tabload.util.ErrorHandler;
import io.github.yok.tabload.util.PerformanceMonitor;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options {@code --load}/{@code -l}, {@code --query}/{@code -q} and
 * {@code --report}/{@code -r}, then runs the matching step against the configured target.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --load} or {@code -l} (default) reads the {@code source} file and loads it into the
 * {@code target} table.</li>
 * <li>{@code --query} or {@code -q} runs the sample lookups and prints them as CSV.</li>
 * <li>{@code --report} or {@code -r} prints the aggregate reports as CSV.</li>
 * </ul>
 *
 * <p>
 * Every step is measured with {@link PerformanceMonitor}. A failure is reported through
 * {@link ErrorHandler} and turns into exit code {@value ErrorHandler#EXIT_FAILURE}.
 * </p>
 *
 * <p>
 * Connections are opened per operation by {@link DataSourceFactory}, so Spring Boot's own
 * {@code DataSource} auto-configuration is disabled.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see SourceConfig
 * @see TargetConfig
 * @see DbDialectHandlerFactory
 */
@Slf4j
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final SourceConfig sourceConfig;
    private final TargetConfig targetConfig;
    private final ConfigValidator configValidator;
    private final TargetDescriptorFactory descriptorFactory;
    private final DbDialectHandlerFactory dialectFactory;
    private final DbUnitConfigFactory dbUnitConfigFactory;
    private final DataSourceFactory dataSourceFactory;

    private final PerformanceMonitor monitor = new PerformanceMonitor();

    private PrintStream out = System.out;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the code of the executed step.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String mode = null;
        for (String arg : args) {
            switch (arg) {
                case "--load":
                case "-l":
                    mode = "load";
                    break;
                case "--query":
                case "-q":
                    mode = "query";
                    break;
                case "--report":
                case "-r":
                    mode = "report";
                    break;
                default:
                    log.warn("Unknown argument: {}", arg);
            }
        }
        if (mode == null) {
            mode = "load";
        }
        log.info("Mode: {}", mode);

        try {
            TargetDescriptor target = descriptorFactory.create(targetConfig);
            log.info("Target: {}", target.describe());
            DataSource dataSource = dataSourceFactory.create(target);
            TableSchema schema = TableSchema.employees();

            switch (mode) {
                case "query":
                    runQueries(new RetrievalService(schema, target.getTable(), dataSource));
                    break;
                case "report":
                    runReports(new AggregateReportingService(target.getTable(), dataSource));
                    break;
                default:
                    runLoad(target, schema, dataSource);
            }
            exitCode = 0;
        } catch (RuntimeException e) {
            exitCode = ErrorHandler.errorAndExit(mode, e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // Redirects printed results (tests)
    void setOut(PrintStream out) {
        this.out = out;
    }

    private void runLoad(TargetDescriptor target, TableSchema schema, DataSource dataSource) {
        configValidator.validateSource(sourceConfig);
        RowSet rows = monitor
                .measure("read", () -> new TabularReader(sourceConfig, schema).read())
                .getResult();

        BackendType type = target.getBackendType();
        DbDialectHandler dialect = dialectFactory.create(type);
        RelationalSink sink =
                new RelationalSink(target, schema, dataSource, dialect, dbUnitConfigFactory);
        LoadResult result = monitor.measure("load", () -> sink.load(rows)).getResult();
        log.info("Load completed: {} rows written in {} batches, table now holds {} rows",
                result.getRowsWritten(), result.getBatches(), sink.countRows());
    }

    private void runQueries(RetrievalService retrieval) {
        printRows("Engineering by salary (desc)",
                monitor.measure("query.department", () -> retrieval.findByDepartment(
                        "Engineering", SortSpec.desc("salary")))
                        .getResult());
        printRows("Salary above 100000",
                monitor.measure("query.salary",
                        () -> retrieval.findBySalaryAbove(new BigDecimal("100000"))).getResult());
        printRows("Senior level",
                monitor.measure("query.level", () -> retrieval.findByLevel("Senior", null))
                        .getResult());
    }

    private void runReports(AggregateReportingService reports) {
        List<DepartmentMetrics> departments =
                monitor.measure("report.department", reports::departmentMetrics).getResult();
        print("Department metrics",
                List.of("department", "employees", "avg_salary", "min_salary", "max_salary",
                        "total_payroll"),
                departments.stream()
                        .map(m -> Arrays.<Object>asList(m.getDepartment(), m.getEmployeeCount(),
                                m.getAverageSalary(), m.getMinSalary(), m.getMaxSalary(),
                                m.getTotalPayroll()))
                        .collect(Collectors.toList()));

        List<LevelMetrics> levels =
                monitor.measure("report.level", reports::levelMetrics).getResult();
        print("Level metrics",
                List.of("level", "employees", "avg_salary", "min_salary", "max_salary",
                        "total_payroll"),
                levels.stream()
                        .map(m -> Arrays.<Object>asList(m.getLevel(), m.getEmployeeCount(),
                                m.getAverageSalary(), m.getMinSalary(), m.getMaxSalary(),
                                m.getTotalPayroll()))
                        .collect(Collectors.toList()));

        List<DepartmentLevelMetrics> distribution = monitor
                .measure("report.department_level", reports::departmentLevelDistribution)
                .getResult();
        print("Department/level distribution",
                List.of("department", "level", "employees", "avg_salary"),
                distribution.stream()
                        .map(m -> Arrays.<Object>asList(m.getDepartment(), m.getLevel(),
                                m.getEmployeeCount(), m.getAverageSalary()))
                        .collect(Collectors.toList()));

        List<SalaryBandMetrics> bands =
                monitor.measure("report.salary_band", reports::salaryBands).getResult();
        print("Salary bands",
                List.of("band", "employees", "avg_salary", "min_salary", "max_salary"),
                bands.stream()
                        .map(m -> Arrays.<Object>asList(m.getBand().getLabel(),
                                m.getEmployeeCount(), m.getAverageSalary(), m.getMinSalary(),
                                m.getMaxSalary()))
                        .collect(Collectors.toList()));

        List<OccupationMetrics> occupations =
                monitor.measure("report.occupation", reports::occupationMetrics).getResult();
        print("Occupation metrics",
                List.of("occupation", "employees", "avg_salary", "min_salary", "max_salary"),
                occupations.stream()
                        .map(m -> Arrays.<Object>asList(m.getOccupation(), m.getEmployeeCount(),
                                m.getAverageSalary(), m.getMinSalary(), m.getMaxSalary()))
                        .collect(Collectors.toList()));
    }

    private void printRows(String title, RowSet rows) {
        print(title, rows.getSchema().getColumnNames(),
                rows.stream().map(Row::getValues).collect(Collectors.toList()));
    }

    private void print(String title, List<String> headers, List<List<Object>> rows) {
        out.println("# " + title);
        CsvUtils.print(out, headers, rows);
        out.println();
    }
}
