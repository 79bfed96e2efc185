package io.github.yok.tabload.schema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.ResultSet;
import java.sql.SQLException;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Semantic column types supported by the declared table schema.
 *
 * <p>
 * Each type knows its SQL declaration, how to convert a source cell or a row value, how to bind a
 * query parameter, and how to read a column from a {@link ResultSet}. Row values of
 * {@link #DECIMAL} are normalized to {@value #DECIMAL_SCALE} fraction digits so that values read
 * from the source and from the database compare equal. Query parameters keep the caller's scale.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum ColumnType {

    // 32-bit integer
    INTEGER("INTEGER") {
        @Override
        public Object coerce(Object value) {
            if (value == null || value instanceof Integer) {
                return value;
            }
            if (value instanceof Number) {
                return toBigDecimal(value).intValueExact();
            }
            return parse(value.toString());
        }

        @Override
        Object parseNonBlank(String text) {
            return new BigDecimal(text).intValueExact();
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            int value = rs.getInt(column);
            return rs.wasNull() ? null : value;
        }
    },

    // Variable length text
    VARCHAR("VARCHAR(255)") {
        @Override
        public Object coerce(Object value) {
            return value == null ? null : value.toString();
        }

        @Override
        Object parseNonBlank(String text) {
            return text;
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            return rs.getString(column);
        }
    },

    // Fixed point number with two fraction digits
    DECIMAL("DECIMAL(15,2)") {
        @Override
        public Object coerce(Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof Number) {
                return normalize(toBigDecimal(value));
            }
            return parse(value.toString());
        }

        @Override
        public Object bind(Object value) {
            if (value == null || value instanceof BigDecimal) {
                return value;
            }
            if (value instanceof Number) {
                return toBigDecimal(value);
            }
            String text = value.toString();
            return StringUtils.isBlank(text) ? null : new BigDecimal(text.trim());
        }

        @Override
        Object parseNonBlank(String text) {
            return normalize(new BigDecimal(text));
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            return normalize(rs.getBigDecimal(column));
        }
    };

    /**
     * Number of fraction digits kept for {@link #DECIMAL} values.
     */
    public static final int DECIMAL_SCALE = 2;

    // Type name used in CREATE TABLE
    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    /**
     * Converts a caller-supplied value to the Java representation of this type.
     *
     * @param value raw value, may be {@code null}
     * @return converted value, or {@code null}
     * @throws NumberFormatException if the value cannot be represented by this type
     * @throws ArithmeticException if a numeric value has a fractional part for {@link #INTEGER}
     */
    public abstract Object coerce(Object value);

    /**
     * Converts a query parameter to the Java type of this column without changing its value.
     *
     * @param value raw value, may be {@code null}
     * @return converted value, or {@code null}
     * @throws NumberFormatException if the value cannot be represented by this type
     */
    public Object bind(Object value) {
        return coerce(value);
    }

    /**
     * Reads this column from the current row.
     *
     * @param rs result set positioned on a row
     * @param column column label
     * @return typed value, or {@code null} for SQL NULL
     * @throws SQLException on column access error
     */
    public abstract Object read(ResultSet rs, String column) throws SQLException;

    abstract Object parseNonBlank(String text);

    /**
     * Parses a source cell. Blank cells become {@code null}.
     *
     * @param text cell text
     * @return typed value, or {@code null}
     * @throws NumberFormatException if the text is not a valid value of this type
     */
    public Object parse(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        try {
            return parseNonBlank(text.trim());
        } catch (ArithmeticException e) {
            throw new NumberFormatException("Not a whole number: " + text);
        }
    }

    /**
     * Normalizes a decimal to {@value #DECIMAL_SCALE} fraction digits.
     *
     * @param value value, may be {@code null}
     * @return normalized value, or {@code null}
     */
    public static BigDecimal normalize(BigDecimal value) {
        return value == null ? null : value.setScale(DECIMAL_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal toBigDecimal(Object number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        return new BigDecimal(number.toString());
    }
}
