package io.github.yok.tabload.util;

import lombok.Generated;

/**
 * Utility for masking credentials before connection details are logged.
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a sensitive text entirely.
     *
     * @param value raw text
     * @return {@code ***}, the empty string for empty input, or {@code null} for {@code null}
     */
    public static String maskText(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return "***";
    }
}
