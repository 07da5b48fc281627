package de.bsommerfeld.topiccorpus.core.lexicon;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LexiconTest {

    private static Lexicon lexicon;

    @BeforeAll
    static void load() {
        lexicon = LexiconLoader.loadDefault();
    }

    // -- fold --

    @Test
    void fold_shouldMapTurkishLettersToAscii() {
        assertEquals("guvenligi", lexicon.fold("güvenliği"));
        assertEquals("cicek sasi", lexicon.fold("çiçek şası"));
        assertEquals("Istanbul", lexicon.fold("İstanbul"));
    }

    @Test
    void fold_shouldLeaveAsciiUntouched() {
        assertEquals("haptic glove", lexicon.fold("haptic glove"));
        assertEquals("", lexicon.fold(null));
    }

    // -- casefold --

    @Test
    void casefold_shouldDropCombiningDotOfCapitalDottedI() {
        assertEquals("istanbul", Lexicon.casefold("İstanbul"));
    }

    // -- clean --

    @Test
    void clean_shouldKeepAllowListCharacters() {
        assertEquals("c++ c# a-b a/b a_b v1.2", lexicon.clean("c++ c# a-b a/b a_b v1.2"));
        assertEquals("güvenlik", lexicon.clean("güvenlik"));
    }

    @Test
    void clean_shouldReplaceOtherCharactersWithSpace() {
        assertEquals("hello  world ", lexicon.clean("hello, world!"));
    }

    // -- normalizeLookup --

    @Test
    void normalizeLookup_shouldCollapseFoldAndLowercase() {
        assertEquals("yapay zeka", lexicon.normalizeLookup("  Yapay   ZEKA "));
        assertEquals("kullanici deneyimi", lexicon.normalizeLookup("Kullanıcı Deneyimi"));
    }

    // -- SuffixRule --

    @Test
    void suffixRule_shouldApplyReplacement() {
        assertEquals("güvenlik", new SuffixRule("ği", "k").strip("güvenliği", 3));
    }

    @Test
    void suffixRule_shouldRefuseShortStems() {
        assertNull(new SuffixRule("ler", null).strip("evler", 3));
        assertEquals("kitap", new SuffixRule("lar", null).strip("kitaplar", 3));
        assertNull(new SuffixRule("lar", null).strip("kitap", 3));
    }
}
