package pl.marcinmilkowski.word_diff.graph;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MapDefinitionGraphTest {

    @Test
    @DisplayName("expand() should return definition tokens in order")
    void testExpandDefined() {
        MapDefinitionGraph graph = MapDefinitionGraph.builder()
            .define("money", "business", "debt")
            .build();

        assertEquals(List.of("business", "debt"), graph.expand("money"));
        assertTrue(graph.contains("money"));
        assertEquals(1, graph.size());
    }

    @Test
    @DisplayName("Unknown and empty definitions should self-loop")
    void testSelfLoop() {
        MapDefinitionGraph graph = MapDefinitionGraph.builder()
            .define("void", List.of())
            .build();

        assertEquals(List.of("zyzzyva"), graph.expand("zyzzyva"));
        assertEquals(List.of("void"), graph.expand("void"));
        assertFalse(graph.contains("void"));
        assertFalse(graph.contains("zyzzyva"));
    }

    @Test
    @DisplayName("Terms and tokens should be normalized, blank tokens dropped")
    void testNormalization() {
        MapDefinitionGraph graph = MapDefinitionGraph.builder()
            .define(" Money ", "Business", "  ", "DEBT ")
            .build();

        assertEquals(List.of("business", "debt"), graph.expand("money"));
    }

    @Test
    @DisplayName("First definition of a term should win")
    void testFirstDefinitionWins() {
        MapDefinitionGraph graph = MapDefinitionGraph.builder()
            .define("cat", "animal")
            .define("CAT", "pet")
            .build();

        assertEquals(List.of("animal"), graph.expand("cat"));
        assertEquals(1, graph.size());
    }

    @Test
    void testBlankTermRejected() {
        MapDefinitionGraph.Builder builder = MapDefinitionGraph.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.define("  ", "x"));
    }

    @Test
    void testDefinitionsAreUnmodifiable() {
        MapDefinitionGraph graph = TestGraphs.moneyBusiness();
        assertThrows(UnsupportedOperationException.class, () -> graph.expand("money").add("x"));
        assertThrows(UnsupportedOperationException.class, () -> graph.definitions().remove("money"));
    }
}
