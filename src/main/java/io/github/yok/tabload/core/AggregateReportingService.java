package io.github.yok.tabload.core;

import io.github.yok.tabload.report.DepartmentLevelMetrics;
import io.github.yok.tabload.report.DepartmentMetrics;
import io.github.yok.tabload.report.LevelMetrics;
import io.github.yok.tabload.report.OccupationMetrics;
import io.github.yok.tabload.report.SalaryBand;
import io.github.yok.tabload.report.SalaryBandMetrics;
import io.github.yok.tabload.schema.ColumnType;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Fixed grouping reports over the employee table.
 *
 * <p>
 * Queries carry no user-supplied values; the table name is validated by the configuration layer
 * before it reaches this class. Averages are rounded to two decimal places.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AggregateReportingService {

    private final String table;

    private final JdbcTemplate jdbcTemplate;

    public AggregateReportingService(String table, DataSource dataSource) {
        this.table = table;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    /**
     * Returns headcount and salary statistics per department, largest total payroll first.
     *
     * @return one entry per department
     */
    public List<DepartmentMetrics> departmentMetrics() {
        String sql = "SELECT department, COUNT(*) AS employee_count, AVG(salary) AS avg_salary,"
                + " MIN(salary) AS min_salary, MAX(salary) AS max_salary,"
                + " SUM(salary) AS total_payroll FROM " + table
                + " GROUP BY department ORDER BY total_payroll DESC, department ASC";
        List<DepartmentMetrics> result = jdbcTemplate.query(sql,
                (rs, rowNum) -> new DepartmentMetrics(rs.getString("department"),
                        rs.getLong("employee_count"), decimal(rs, "avg_salary"),
                        decimal(rs, "min_salary"), decimal(rs, "max_salary"),
                        decimal(rs, "total_payroll")));
        log.info("Department report: {} groups", result.size());
        return result;
    }

    /**
     * Returns salary statistics per level, highest average first.
     *
     * @return one entry per level
     */
    public List<LevelMetrics> levelMetrics() {
        String sql = "SELECT level, COUNT(*) AS employee_count, AVG(salary) AS avg_salary,"
                + " MIN(salary) AS min_salary, MAX(salary) AS max_salary,"
                + " SUM(salary) AS total_payroll FROM " + table
                + " GROUP BY level ORDER BY avg_salary DESC, level ASC";
        List<LevelMetrics> result = jdbcTemplate.query(sql,
                (rs, rowNum) -> new LevelMetrics(rs.getString("level"),
                        rs.getLong("employee_count"), decimal(rs, "avg_salary"),
                        decimal(rs, "min_salary"), decimal(rs, "max_salary"),
                        decimal(rs, "total_payroll")));
        log.info("Level report: {} groups", result.size());
        return result;
    }

    /**
     * Returns headcount and average salary per department and level, ordered by department then
     * average salary descending.
     *
     * @return one entry per (department, level) pair
     */
    public List<DepartmentLevelMetrics> departmentLevelDistribution() {
        String sql = "SELECT department, level, COUNT(*) AS employee_count,"
                + " AVG(salary) AS avg_salary FROM " + table
                + " GROUP BY department, level ORDER BY department ASC, avg_salary DESC, level ASC";
        List<DepartmentLevelMetrics> result = jdbcTemplate.query(sql,
                (rs, rowNum) -> new DepartmentLevelMetrics(rs.getString("department"),
                        rs.getString("level"), rs.getLong("employee_count"),
                        decimal(rs, "avg_salary")));
        log.info("Department/level report: {} groups", result.size());
        return result;
    }

    /**
     * Returns statistics for every salary band in ascending band order. Bands without employees
     * are reported with a count of zero.
     *
     * @return exactly one entry per {@link SalaryBand}
     */
    public List<SalaryBandMetrics> salaryBands() {
        String sql = "SELECT band, COUNT(*) AS employee_count, AVG(salary) AS avg_salary,"
                + " MIN(salary) AS min_salary, MAX(salary) AS max_salary FROM (SELECT "
                + SalaryBand.caseExpression("salary") + " AS band, salary FROM " + table
                + ") banded GROUP BY band";
        Map<SalaryBand, SalaryBandMetrics> found = new EnumMap<>(SalaryBand.class);
        jdbcTemplate.query(sql, rs -> {
            SalaryBand band = SalaryBand.fromLabel(StringUtils.trim(rs.getString("band")));
            found.put(band, new SalaryBandMetrics(band, rs.getLong("employee_count"),
                    decimal(rs, "avg_salary"), decimal(rs, "min_salary"),
                    decimal(rs, "max_salary")));
        });
        List<SalaryBandMetrics> result = new ArrayList<>();
        for (SalaryBand band : SalaryBand.values()) {
            result.add(found.getOrDefault(band, SalaryBandMetrics.empty(band)));
        }
        log.info("Salary band report: {} populated of {}", found.size(), result.size());
        return result;
    }

    /**
     * Returns salary statistics per occupation, highest average first.
     *
     * @return one entry per occupation
     */
    public List<OccupationMetrics> occupationMetrics() {
        String sql = "SELECT occupation, COUNT(*) AS employee_count, AVG(salary) AS avg_salary,"
                + " MIN(salary) AS min_salary, MAX(salary) AS max_salary FROM " + table
                + " GROUP BY occupation ORDER BY avg_salary DESC, occupation ASC";
        List<OccupationMetrics> result = jdbcTemplate.query(sql,
                (rs, rowNum) -> new OccupationMetrics(rs.getString("occupation"),
                        rs.getLong("employee_count"), decimal(rs, "avg_salary"),
                        decimal(rs, "min_salary"), decimal(rs, "max_salary")));
        log.info("Occupation report: {} groups", result.size());
        return result;
    }

    private static BigDecimal decimal(ResultSet rs, String column) throws SQLException {
        return ColumnType.normalize(rs.getBigDecimal(column));
    }
}
