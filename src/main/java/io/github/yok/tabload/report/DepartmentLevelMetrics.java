package io.github.yok.tabload.report;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Head count and average salary of one department and level pair.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class DepartmentLevelMetrics {
    String department;
    String level;
    long employeeCount;
    BigDecimal averageSalary;
}
