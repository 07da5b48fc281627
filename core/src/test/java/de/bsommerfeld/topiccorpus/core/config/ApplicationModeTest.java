package de.bsommerfeld.topiccorpus.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    @Test
    void resolve_shouldReturnProdWhenNothingIsSet() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve(null, null));
    }

    @Test
    void resolve_shouldPreferSystemProperty() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve("TEST", "PROD"));
    }

    @Test
    void resolve_shouldFallBackToEnvironment() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve(null, "TEST"));
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve("  ", "test"));
    }

    @Test
    void resolve_shouldBeCaseInsensitive() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve("test", null));
    }

    @Test
    void resolve_shouldDefaultToProdForInvalidValue() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("INVALID_GARBAGE", null));
    }

    @Test
    void get_shouldResolveFromSystemProperty() {
        String original = System.getProperty("corpus.mode");
        try {
            System.setProperty("corpus.mode", "TEST");
            assertEquals(ApplicationMode.TEST, ApplicationMode.get());
        } finally {
            if (original != null)
                System.setProperty("corpus.mode", original);
            else
                System.clearProperty("corpus.mode");
        }
    }

    @Test
    void isTest_shouldReflectMode() {
        assertTrue(ApplicationMode.TEST.isTest());
        assertFalse(ApplicationMode.PROD.isTest());
    }
}
