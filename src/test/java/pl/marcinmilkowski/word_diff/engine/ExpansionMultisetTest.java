package pl.marcinmilkowski.word_diff.engine;

import org.junit.jupiter.api.*;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpansionMultisetTest {

    @Test
    @DisplayName("Terms should iterate in first-insertion order")
    void testInsertionOrder() {
        ExpansionMultiset multiset = new ExpansionMultiset();
        multiset.add("zebra", 1);
        multiset.add("apple", 2);
        multiset.add("zebra", 3);
        multiset.add("mango", 1);

        assertEquals(List.of("zebra", "apple", "mango"), multiset.terms());
        assertEquals(BigInteger.valueOf(4), multiset.count("zebra"));
        assertEquals(BigInteger.valueOf(7), multiset.total());
        assertEquals(3, multiset.distinct());
    }

    @Test
    @DisplayName("Negative counts should fail fast")
    void testNegativeCount() {
        ExpansionMultiset multiset = ExpansionMultiset.of("a", 1);
        assertThrows(IllegalStateException.class, () -> multiset.add("a", -1));
        assertEquals(BigInteger.valueOf(1), multiset.count("a"));
    }

    @Test
    @DisplayName("Counts should grow past the range of long")
    void testCountsBeyondLong() {
        ExpansionMultiset multiset = ExpansionMultiset.of("a", Long.MAX_VALUE);
        multiset.add("a", 1);
        multiset.add("b", Long.MAX_VALUE);

        BigInteger expected = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);
        assertEquals(expected, multiset.count("a"));
        assertEquals(expected.add(BigInteger.valueOf(Long.MAX_VALUE)), multiset.total());
    }

    @Test
    void testRemove() {
        ExpansionMultiset multiset = ExpansionMultiset.of("a", 3);
        assertEquals(BigInteger.valueOf(3), multiset.remove("a"));
        assertEquals(BigInteger.valueOf(0), multiset.remove("a"));
        assertTrue(multiset.isEmpty());
    }

    @Test
    @DisplayName("copy() should be independent of the original")
    void testCopy() {
        ExpansionMultiset original = ExpansionMultiset.of("a", 1);
        ExpansionMultiset copy = original.copy();
        copy.remove("a");

        assertTrue(original.contains("a"));
        assertFalse(copy.contains("a"));
        assertNotEquals(original, copy);
    }

    @Test
    void testAsMapIsReadOnly() {
        ExpansionMultiset multiset = ExpansionMultiset.of("a", 1);
        assertThrows(UnsupportedOperationException.class, () -> multiset.asMap().put("b", BigInteger.valueOf(1)));
    }
}
