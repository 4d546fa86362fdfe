package pl.marcinmilkowski.word_diff.engine;

import pl.marcinmilkowski.word_diff.config.EngineConfig;
import pl.marcinmilkowski.word_diff.graph.DefinitionGraph;

import java.util.Objects;

/**
 * Immutable handle on everything a run reads: the definition graph and the engine config.
 * Built once and passed to every run; runs never write to it.
 */
public record DifferentiationContext(DefinitionGraph graph, EngineConfig config) {

    public DifferentiationContext {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(config, "config");
    }

    public static DifferentiationContext of(DefinitionGraph graph) {
        return new DifferentiationContext(graph, EngineConfig.defaults());
    }

    public GreatDifferentiation greatDifferentiation() {
        return new GreatDifferentiation(graph);
    }

    public DifferentiationRun run(RepetitionPolicy policy) {
        return new DifferentiationRun(this, policy);
    }
}
