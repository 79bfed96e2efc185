package io.github.yok.tabload.config;

import io.github.yok.tabload.exception.UnsupportedModeException;
import java.util.Locale;

/**
 * Write semantics of a load.
 *
 * <ul>
 * <li>{@link #APPEND}: insert without touching existing rows; the table is created if absent.</li>
 * <li>{@link #REPLACE}: drop and recreate the table, then insert; afterwards the table holds
 * exactly the loaded rows.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum LoadMode {
    APPEND, REPLACE;

    /**
     * Resolves a mode from its configured name (case-insensitive, surrounding blanks ignored).
     *
     * @param value configured mode
     * @return load mode
     * @throws UnsupportedModeException for anything other than {@code append} or {@code replace}
     */
    public static LoadMode fromValue(String value) {
        if (value != null) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "append":
                    return APPEND;
                case "replace":
                    return REPLACE;
                default:
                    break;
            }
        }
        throw new UnsupportedModeException(value);
    }
}
