package io.github.yok.tabload.report;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Salary statistics of one department.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class DepartmentMetrics {
    String department;
    long employeeCount;
    BigDecimal averageSalary;
    BigDecimal minSalary;
    BigDecimal maxSalary;
    BigDecimal totalPayroll;
}
