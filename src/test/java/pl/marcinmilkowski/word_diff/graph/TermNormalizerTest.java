package pl.marcinmilkowski.word_diff.graph;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class TermNormalizerTest {

    @Test
    @DisplayName("normalize() should case-fold and trim")
    void testNormalize() {
        assertEquals("money", TermNormalizer.normalize("  Money\t"));
        assertEquals("new york", TermNormalizer.normalize("New York "));
        assertEquals("", TermNormalizer.normalize(null));
        assertEquals("", TermNormalizer.normalize("   "));
    }

    @Test
    @DisplayName("normalize() should be idempotent")
    void testIdempotent() {
        for (String raw : new String[] {"  CaT ", "Straße", "İstanbul", "x", "", " \t MIXED case \n"}) {
            String once = TermNormalizer.normalize(raw);
            assertEquals(once, TermNormalizer.normalize(once), "Not idempotent for '" + raw + "'");
        }
    }

    @Test
    void testIsBlank() {
        assertTrue(TermNormalizer.isBlank(null));
        assertTrue(TermNormalizer.isBlank(" \t "));
        assertFalse(TermNormalizer.isBlank(" a "));
    }
}
