package io.github.yok.tabload.config;

import io.github.yok.tabload.exception.ConfigInvalidException;
import java.util.Arrays;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Enumeration of supported relational backends.
 *
 * <p>
 * The embedded backend is file resident and needs no network; it is also the only backend whose
 * indexes are managed by the sink. Networked backends are reached through host, port and
 * credentials.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum BackendType {

    // H2 file database
    H2("h2", true, "org.h2.Driver", 0),

    // PostgreSQL server
    POSTGRESQL("postgresql", false, "org.postgresql.Driver", 5432),

    // MySQL server
    MYSQL("mysql", false, "com.mysql.cj.jdbc.Driver", 3306);

    // Name used in target.type and as the JDBC sub-protocol
    private final String scheme;

    // true for file-resident engines
    private final boolean embedded;

    // JDBC driver class
    private final String driverClass;

    // Default port of networked engines (0 for embedded)
    private final int defaultPort;

    /**
     * Resolves a backend by its configured name (case-insensitive).
     *
     * @param value configured {@code target.type}
     * @return backend type
     * @throws ConfigInvalidException if the value is blank or unknown
     */
    public static BackendType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigInvalidException("target.type", "is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.scheme.equals(normalized)).findFirst()
                .orElseThrow(() -> new ConfigInvalidException("target.type",
                        "unsupported backend '" + value + "'; expected one of "
                                + Arrays.toString(Arrays.stream(values())
                                        .map(BackendType::getScheme).toArray())));
    }
}
