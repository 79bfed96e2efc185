package io.github.yok.tabload.config;

import com.google.common.collect.ImmutableSet;
import io.github.yok.tabload.exception.ConfigInvalidException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Validates the {@code source} and {@code target} sections before any component is built.
 *
 * <p>
 * Rejects incomplete combinations early so the CLI can report a clear configuration failure
 * instead of failing half-way through a load.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ConfigValidator {

    // Unquoted SQL identifier; the table name is embedded literally in statements
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");

    // Words reserved by at least one of H2, PostgreSQL and MySQL; unusable as unquoted names
    private static final ImmutableSet<String> RESERVED_WORDS = ImmutableSet.of("ALL", "AND",
            "ANY", "ARRAY", "AS", "ASC", "BETWEEN", "BOTH", "BY", "CASE", "CAST", "CHECK",
            "COLUMN", "CONSTRAINT", "CREATE", "CROSS", "CURRENT_DATE", "CURRENT_TIME",
            "CURRENT_TIMESTAMP", "CURRENT_USER", "DEFAULT", "DELETE", "DESC", "DISTINCT", "DROP",
            "ELSE", "END", "EXCEPT", "EXISTS", "FALSE", "FETCH", "FOR", "FOREIGN", "FROM", "FULL",
            "GROUP", "HAVING", "IF", "IN", "INDEX", "INNER", "INSERT", "INTERSECT", "INTERVAL",
            "INTO", "IS", "JOIN", "KEY", "LEADING", "LEFT", "LIKE", "LIMIT", "NATURAL", "NOT",
            "NULL", "OFFSET", "ON", "OR", "ORDER", "PRIMARY", "REFERENCES", "RIGHT", "ROW", "ROWS",
            "SELECT", "SET", "SOME", "TABLE", "THEN", "TO", "TRAILING", "TRUE", "UNION", "UNIQUE",
            "UNKNOWN", "UPDATE", "USER", "USING", "VALUE", "VALUES", "WHEN", "WHERE", "WINDOW",
            "WITH");

    /**
     * Validates the source section.
     *
     * @param config source configuration
     * @throws ConfigInvalidException if a field is missing or malformed
     */
    public void validateSource(SourceConfig config) {
        if (config == null) {
            throw new ConfigInvalidException("source", "section is required");
        }
        if (StringUtils.isBlank(config.getFilePath())) {
            throw new ConfigInvalidException("source.file-path", "is required");
        }
        if (config.getDelimiter() == null || config.getDelimiter().length() != 1) {
            throw new ConfigInvalidException("source.delimiter",
                    "must be a single character but was '" + config.getDelimiter() + "'");
        }
        if (StringUtils.isBlank(config.getEncoding())) {
            throw new ConfigInvalidException("source.encoding", "is required");
        }
        try {
            if (!Charset.isSupported(config.getEncoding().trim())) {
                throw new ConfigInvalidException("source.encoding",
                        "unsupported charset '" + config.getEncoding() + "'");
            }
        } catch (IllegalCharsetNameException e) {
            throw new ConfigInvalidException("source.encoding",
                    "illegal charset name '" + config.getEncoding() + "'");
        }
        log.debug("Source configuration OK: {}", config);
    }

    /**
     * Validates the target section.
     *
     * <p>
     * The load mode is resolved through {@link LoadMode#fromValue(String)}, so an unknown mode
     * surfaces as {@link io.github.yok.tabload.exception.UnsupportedModeException}.
     * </p>
     *
     * @param config target configuration
     * @throws ConfigInvalidException if a field is missing or malformed
     */
    public void validateTarget(TargetConfig config) {
        if (config == null) {
            throw new ConfigInvalidException("target", "section is required");
        }
        BackendType type = BackendType.fromValue(config.getType());

        if (StringUtils.isBlank(config.getDatabase())) {
            throw new ConfigInvalidException("target.database", "is required");
        }
        if (!type.isEmbedded()) {
            if (StringUtils.isBlank(config.getHost())) {
                throw new ConfigInvalidException("target.host",
                        "is required for backend '" + type.getScheme() + "'");
            }
            Integer port = config.getPort();
            if (port != null && (port < 1 || port > 65535)) {
                throw new ConfigInvalidException("target.port", "out of range: " + port);
            }
        }
        if (config.getTable() == null || !IDENTIFIER.matcher(config.getTable().trim()).matches()) {
            throw new ConfigInvalidException("target.table",
                    "must be a plain SQL identifier but was '" + config.getTable() + "'");
        }
        if (RESERVED_WORDS.contains(config.getTable().trim().toUpperCase(Locale.ROOT))) {
            throw new ConfigInvalidException("target.table",
                    "'" + config.getTable().trim() + "' is a reserved SQL word");
        }
        if (config.getBatchSize() <= 0) {
            throw new ConfigInvalidException("target.batch-size",
                    "must be positive but was " + config.getBatchSize());
        }
        LoadMode.fromValue(config.getMode());
        log.debug("Target configuration OK: type={}, table={}, mode={}", type.getScheme(),
                config.getTable(), config.getMode());
    }
}
