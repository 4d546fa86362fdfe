package pl.marcinmilkowski.word_diff.engine;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.word_diff.config.EngineConfig;
import pl.marcinmilkowski.word_diff.graph.MapDefinitionGraph;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Running and full-history accumulation must take identical cancellation decisions.
 * Compared on random graphs generated from a fixed seed.
 */
class AccumulationStrategyTest {

    private static final int GRAPHS = 60;
    private static final int MAX_LEVEL = 7;

    private static MapDefinitionGraph randomGraph(Random random, List<String> vocabulary) {
        MapDefinitionGraph.Builder builder = MapDefinitionGraph.builder();
        for (String term : vocabulary) {
            if (random.nextDouble() < 0.75) {
                int length = 1 + random.nextInt(3);
                List<String> tokens = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    tokens.add(vocabulary.get(random.nextInt(vocabulary.size())));
                }
                builder.define(term, tokens);
            }
        }
        return builder.build();
    }

    /**
     * Per observed level, the U and R maps of every recorded level and side.
     */
    private static List<String> recordingOf(MapDefinitionGraph graph, AccumulationStrategy strategy,
                                            RepetitionPolicy policy, String a, String b,
                                            List<DifferentiationResult> results) {
        List<String> snapshots = new ArrayList<>();
        RunObserver observer = (level, history) -> {
            StringBuilder sb = new StringBuilder();
            for (int l = 0; l <= level; l++) {
                for (Side side : Side.values()) {
                    sb.append(l).append(side).append(history.unique(l, side)).append(history.repeated(l, side));
                }
            }
            snapshots.add(sb.toString());
        };
        EngineConfig config = EngineConfig.defaults().withAccumulation(strategy);
        results.add(new DifferentiationContext(graph, config).run(policy).run(a, b, MAX_LEVEL, observer));
        return snapshots;
    }

    @Test
    @DisplayName("RUNNING and FULL_HISTORY should agree on random graphs")
    void testStrategiesAgree() {
        Random random = new Random(20240611L);
        List<String> vocabulary = List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k", "l");

        int terminated = 0;
        for (int g = 0; g < GRAPHS; g++) {
            MapDefinitionGraph graph = randomGraph(random, vocabulary);
            String seedA = vocabulary.get(random.nextInt(vocabulary.size()));
            String seedB = vocabulary.get(random.nextInt(vocabulary.size()));

            for (RepetitionPolicy policy : RepetitionPolicy.values()) {
                List<DifferentiationResult> results = new ArrayList<>();
                List<String> full = recordingOf(graph, AccumulationStrategy.FULL_HISTORY, policy, seedA, seedB, results);
                List<String> running = recordingOf(graph, AccumulationStrategy.RUNNING, policy, seedA, seedB, results);

                String label = policy + " on graph " + g + " " + seedA + "/" + seedB;
                DifferentiationResult expected = results.get(0);
                DifferentiationResult actual = results.get(1);

                assertEquals(full, running, label);
                assertEquals(expected.getScore(), actual.getScore(), label);
                assertEquals(expected.getStatus(), actual.getStatus(), label);
                assertEquals(expected.getDiagnostic(), actual.getDiagnostic(), label);
                assertEquals(expected.getProvenanceForest().map(ProvenanceForest::nodes),
                    actual.getProvenanceForest().map(ProvenanceForest::nodes), label);

                if (expected.getStatus().isTerminated()) {
                    terminated++;
                }
            }
        }
        assertTrue(terminated > 0, "Expected at least some runs to terminate");
    }
}
