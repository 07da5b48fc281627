package de.bsommerfeld.topiccorpus.core.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextUtilsTest {

    @Test
    void cleanText_shouldFlattenLineBreaksAndCollapseWhitespace() {
        assertEquals("first line second line", TextUtils.cleanText("  first line\r\n\n second\t line  "));
    }

    @Test
    void cleanText_shouldMapNullToEmpty() {
        assertEquals("", TextUtils.cleanText(null));
    }

    @Test
    void dedupeIgnoreCase_shouldKeepFirstSpelling() {
        assertEquals(List.of("VR", "haptic"),
                TextUtils.dedupeIgnoreCase(Arrays.asList(" VR ", "vr", null, "", "haptic", "Haptic")));
    }

    @Test
    void dedupeIgnoreCase_shouldAcceptNull() {
        assertTrue(TextUtils.dedupeIgnoreCase(null).isEmpty());
    }

    @Test
    void isAscii_shouldRejectDiacritics() {
        assertTrue(TextUtils.isAscii("haptic glove"));
        assertFalse(TextUtils.isAscii("güvenlik"));
    }
}
