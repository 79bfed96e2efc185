package io.github.yok.tabload.report;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Salary statistics of one occupation.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class OccupationMetrics {
    String occupation;
    long employeeCount;
    BigDecimal averageSalary;
    BigDecimal minSalary;
    BigDecimal maxSalary;
}
