package pl.marcinmilkowski.word_diff.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Immutable in-memory definition graph.
 *
 * <p>Keys and tokens are normalized when registered. The first definition
 * registered for a term wins; later ones are ignored.</p>
 *
 * <pre>{@code
 * DefinitionGraph graph = MapDefinitionGraph.builder()
 *     .define("money", "business", "debt")
 *     .define("business", "money", "trade")
 *     .build();
 * }</pre>
 */
public final class MapDefinitionGraph implements DefinitionGraph {

    private static final Logger logger = LoggerFactory.getLogger(MapDefinitionGraph.class);

    private final Map<String, List<String>> definitions;

    private MapDefinitionGraph(Map<String, List<String>> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    @Override
    public List<String> expand(String term) {
        List<String> tokens = definitions.get(term);
        if (tokens == null || tokens.isEmpty()) {
            return List.of(term);
        }
        return tokens;
    }

    @Override
    public boolean contains(String term) {
        List<String> tokens = definitions.get(term);
        return tokens != null && !tokens.isEmpty();
    }

    @Override
    public int size() {
        return definitions.size();
    }

    /**
     * Defined terms in registration order.
     */
    public Set<String> terms() {
        return definitions.keySet();
    }

    /**
     * Raw definitions in registration order (empty definitions included).
     */
    public Map<String, List<String>> definitions() {
        return definitions;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("MapDefinitionGraph[%d terms]", definitions.size());
    }

    /**
     * Builder for {@link MapDefinitionGraph}.
     */
    public static class Builder {
        private final Map<String, List<String>> definitions = new LinkedHashMap<>();
        private int duplicates;

        public Builder define(String term, String... tokens) {
            return define(term, Arrays.asList(tokens));
        }

        public Builder define(String term, List<String> tokens) {
            String key = TermNormalizer.normalize(term);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Blank term cannot be defined");
            }
            if (definitions.containsKey(key)) {
                duplicates++;
                logger.debug("Ignoring duplicate definition for '{}'", key);
                return this;
            }
            List<String> normalized = new ArrayList<>(tokens.size());
            for (String token : tokens) {
                String t = TermNormalizer.normalize(token);
                if (!t.isEmpty()) {
                    normalized.add(t);
                }
            }
            definitions.put(key, Collections.unmodifiableList(normalized));
            return this;
        }

        public MapDefinitionGraph build() {
            if (duplicates > 0) {
                logger.info("Skipped {} duplicate definitions", duplicates);
            }
            return new MapDefinitionGraph(new LinkedHashMap<>(definitions));
        }
    }
}
