package io.github.yok.tabload.report;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * Fixed salary bands. The lower bound is inclusive and the upper bound exclusive; a {@code null}
 * bound is open.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SalaryBand {
    ENTRY("Entry", null, new BigDecimal("80000")),
    MEDIUM("Medium", new BigDecimal("80000"), new BigDecimal("100000")),
    HIGH("High", new BigDecimal("100000"), new BigDecimal("120000")),
    VERY_HIGH("Very High", new BigDecimal("120000"), null);

    private final String label;
    private final BigDecimal lowerBound;
    private final BigDecimal upperBound;

    SalaryBand(String label, BigDecimal lowerBound, BigDecimal upperBound) {
        this.label = label;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    /**
     * Returns {@code true} if the salary falls into this band.
     *
     * @param salary salary to test
     * @return whether the salary is within the bounds
     */
    public boolean contains(BigDecimal salary) {
        if (salary == null) {
            return false;
        }
        boolean aboveLower = lowerBound == null || salary.compareTo(lowerBound) >= 0;
        boolean belowUpper = upperBound == null || salary.compareTo(upperBound) < 0;
        return aboveLower && belowUpper;
    }

    /**
     * Resolves the band of a salary.
     *
     * @param salary non-null salary
     * @return the band containing it
     * @throws IllegalArgumentException if {@code salary} is {@code null}
     */
    public static SalaryBand of(BigDecimal salary) {
        if (salary == null) {
            throw new IllegalArgumentException("salary must not be null");
        }
        for (SalaryBand band : values()) {
            if (band.contains(salary)) {
                return band;
            }
        }
        throw new IllegalStateException("No band for salary " + salary);
    }

    /**
     * Resolves a band from its display label.
     *
     * @param label display label such as {@code "Very High"}
     * @return the band
     * @throws IllegalArgumentException if no band has that label
     */
    public static SalaryBand fromLabel(String label) {
        for (SalaryBand band : values()) {
            if (band.label.equals(label)) {
                return band;
            }
        }
        throw new IllegalArgumentException("Unknown salary band: " + label);
    }

    /**
     * Renders the SQL {@code CASE} expression mapping {@code column} to band labels.
     *
     * @param column salary column name
     * @return the CASE expression
     */
    public static String caseExpression(String column) {
        StringBuilder sql = new StringBuilder("CASE");
        for (SalaryBand band : values()) {
            if (band.upperBound == null) {
                sql.append(" ELSE '").append(band.label).append('\'');
            } else {
                sql.append(" WHEN ").append(column).append(" < ").append(band.upperBound.toPlainString())
                        .append(" THEN '").append(band.label).append('\'');
            }
        }
        return sql.append(" END").toString();
    }
}
