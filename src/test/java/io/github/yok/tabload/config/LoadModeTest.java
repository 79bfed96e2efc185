package io.github.yok.tabload.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.tabload.exception.UnsupportedModeException;
import org.junit.jupiter.api.Test;

class LoadModeTest {

    @Test
    void fromValue_正常ケース_大文字小文字と空白を無視して解決されること() {
        assertEquals(LoadMode.APPEND, LoadMode.fromValue("append"));
        assertEquals(LoadMode.REPLACE, LoadMode.fromValue(" REPLACE "));
    }

    @Test
    void fromValue_異常ケース_未対応の値_UnsupportedModeExceptionが送出されること() {
        UnsupportedModeException ex =
                assertThrows(UnsupportedModeException.class, () -> LoadMode.fromValue("upsert"));
        assertTrue(ex.getMessage().contains("upsert"));
        assertEquals("load", ex.getOperation());

        assertThrows(UnsupportedModeException.class, () -> LoadMode.fromValue("overwrite"));
        assertThrows(UnsupportedModeException.class, () -> LoadMode.fromValue(null));
    }
}
