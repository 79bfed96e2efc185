package io.github.yok.tabload.report;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Salary statistics of one seniority level.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class LevelMetrics {
    String level;
    long employeeCount;
    BigDecimal averageSalary;
    BigDecimal minSalary;
    BigDecimal maxSalary;
    BigDecimal totalPayroll;
}
