package pl.marcinmilkowski.word_diff.engine;

import pl.marcinmilkowski.word_diff.graph.DefinitionGraph;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Advances a multiset one level through the definition graph.
 *
 * <p>Every {@code (term, count)} of the source contributes {@code count} to each token
 * of the term's definition. Sources are walked in their insertion order and tokens in
 * definition order, so the first source that produces a token is well defined.</p>
 */
public class LevelExpansionEngine {

    private final DefinitionGraph graph;

    public LevelExpansionEngine(DefinitionGraph graph) {
        this.graph = graph;
    }

    public List<String> expand(String term) {
        return graph.expand(term);
    }

    public ExpansionMultiset expandMultiset(ExpansionMultiset source) {
        return expandWithProducers(source).multiset();
    }

    /**
     * Expand a multiset and report, for each produced token, the first source term that produced it.
     */
    public Expansion expandWithProducers(ExpansionMultiset source) {
        ExpansionMultiset produced = new ExpansionMultiset();
        Map<String, String> producers = new LinkedHashMap<>();
        for (Map.Entry<String, BigInteger> entry : source.asMap().entrySet()) {
            String sourceTerm = entry.getKey();
            BigInteger count = entry.getValue();
            for (String token : graph.expand(sourceTerm)) {
                produced.add(token, count);
                producers.putIfAbsent(token, sourceTerm);
            }
        }
        return new Expansion(produced, Collections.unmodifiableMap(producers));
    }

    /**
     * One expansion step: the produced multiset and token to first producer.
     */
    public record Expansion(ExpansionMultiset multiset, Map<String, String> producers) {
    }
}
