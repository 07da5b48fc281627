package de.bsommerfeld.topiccorpus.core.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShellSplitterTest {

    @Test
    void split_shouldSeparateOnWhitespace() {
        assertEquals(List.of("haptic", "glove", "vr"), ShellSplitter.split("  haptic \t glove\nvr "));
    }

    @Test
    void split_shouldKeepQuotedPhrasesTogether() {
        assertEquals(List.of("yapay zeka", "güvenlik"), ShellSplitter.split("\"yapay zeka\" güvenlik"));
        assertEquals(List.of("face reading"), ShellSplitter.split("'face reading'"));
    }

    @Test
    void split_shouldJoinAdjacentQuotedAndBareParts() {
        assertEquals(List.of("abc def"), ShellSplitter.split("ab\"c d\"ef"));
    }

    @Test
    void split_shouldHonorBackslashEscapes() {
        assertEquals(List.of("a b", "c"), ShellSplitter.split("a\\ b c"));
        assertEquals(List.of("say \"hi\""), ShellSplitter.split("\"say \\\"hi\\\"\""));
    }

    @Test
    void split_shouldReturnEmptyListForBlankInput() {
        assertTrue(ShellSplitter.split("   ").isEmpty());
    }

    @Test
    void split_shouldRejectUnclosedQuote() {
        assertThrows(IllegalArgumentException.class, () -> ShellSplitter.split("\"yapay zeka"));
    }

    @Test
    void split_shouldRejectTrailingBackslash() {
        assertThrows(IllegalArgumentException.class, () -> ShellSplitter.split("abc\\"));
    }
}
