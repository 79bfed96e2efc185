package io.github.yok.tabload.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import org.junit.jupiter.api.Test;

class MaskingLogUtilTest {

    @Test
    void maskText_正常ケース_値があれば伏字になること() {
        assertEquals("***", MaskingLogUtil.maskText("app"));
        assertEquals("***", MaskingLogUtil.maskText("s3cret"));
    }

    @Test
    void maskText_正常ケース_空文字とnullはそのまま返ること() {
        assertEquals("", MaskingLogUtil.maskText(""));
        assertNull(MaskingLogUtil.maskText(null));
    }
}
