package io.github.yok.tabload.report;

import java.math.BigDecimal;
import lombok.Value;

/**
 * Statistics of one salary band. Statistics are {@code null} when the band has no employees.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SalaryBandMetrics {
    SalaryBand band;
    long employeeCount;
    BigDecimal averageSalary;
    BigDecimal minSalary;
    BigDecimal maxSalary;

    /**
     * Returns the metrics of a band without employees.
     *
     * @param band salary band
     * @return metrics with count 0 and no statistics
     */
    public static SalaryBandMetrics empty(SalaryBand band) {
        return new SalaryBandMetrics(band, 0L, null, null, null);
    }
}
