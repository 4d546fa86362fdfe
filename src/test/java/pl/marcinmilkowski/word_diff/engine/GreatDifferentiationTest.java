package pl.marcinmilkowski.word_diff.engine;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.word_diff.graph.TestGraphs;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GreatDifferentiationTest {

    @Test
    @DisplayName("Identical seeds should terminate at level 0 with nothing uncanceled")
    void testIdenticalSeeds() {
        GreatDifferentiationResult result = new GreatDifferentiation(TestGraphs.moneyBusiness())
            .run("cat", "cat", 10000);

        assertEquals(0, result.terminationLevel());
        assertTrue(result.converged());
        assertTrue(result.uncanceled().isEmpty());
        assertEquals(List.of("cat"), List.copyOf(result.repeated()));
    }

    @Test
    @DisplayName("money / business should reach its fixed point at level 2")
    void testMoneyBusiness() {
        GreatDifferentiationResult result = new GreatDifferentiation(TestGraphs.moneyBusiness())
            .run("money", "business", 10000);

        assertEquals(2, result.terminationLevel());
        assertTrue(result.converged());
        assertEquals(List.of("business", "money", "debt", "trade"), List.copyOf(result.repeated()));
        assertTrue(result.uncanceled().isEmpty());

        assertEquals(3, result.trace().size());
        assertEquals("level=0 opened=0 new=[money, business] repeated=0 uncanceled=2", result.trace().get(0));
        assertEquals("level=1 opened=2 new=[debt, trade] repeated=2 uncanceled=2", result.trace().get(1));
        assertEquals("level=2 opened=2 new=[] repeated=4 uncanceled=0", result.trace().get(2));
    }

    @Test
    @DisplayName("Hitting maxLevel should report the cap without convergence")
    void testLevelCap() {
        GreatDifferentiationResult result = new GreatDifferentiation(TestGraphs.moneyBusiness())
            .run("money", "business", 1);

        assertEquals(1, result.terminationLevel());
        assertFalse(result.converged());
        assertEquals(List.of("debt", "trade"), List.copyOf(result.uncanceled()));
    }

    @Test
    @DisplayName("Unknown seeds should self-loop into repetition at level 1")
    void testUnknownSeeds() {
        GreatDifferentiationResult result = new GreatDifferentiation(TestGraphs.empty())
            .run("alpha", "beta", 10000);

        assertEquals(1, result.terminationLevel());
        assertTrue(result.converged());
    }

    @Test
    @DisplayName("Paths meeting in the middle should stop when the meeting term repeats")
    void testBridge() {
        GreatDifferentiationResult result = new GreatDifferentiation(TestGraphs.bridge())
            .run("a", "b", 10000);

        assertEquals(2, result.terminationLevel());
        assertEquals(List.of("c"), List.copyOf(result.repeated()));
        assertEquals(List.of("a", "b", "x", "y"), List.copyOf(result.uncanceled()));
    }

    @Test
    void testNegativeMaxLevel() {
        GreatDifferentiation gd = new GreatDifferentiation(TestGraphs.empty());
        assertThrows(IllegalArgumentException.class, () -> gd.run("a", "b", -1));
    }
}
