package pl.marcinmilkowski.word_diff.graph;

import java.util.List;

/**
 * Read-only lookup from a term to the ordered tokens of its definition.
 *
 * <p>Implementations must be immutable once handed to the engine and safe to
 * share between threads: every run holds a reference to the same graph.</p>
 *
 * <p>Lookups never fail on unknown vocabulary. A term that is absent, or whose
 * definition is empty, expands to itself:</p>
 * <pre>
 * expand("zyzzyva") == ["zyzzyva"]
 * </pre>
 */
public interface DefinitionGraph {

    /**
     * Expand a normalized term into its definition tokens.
     *
     * @param term normalized term
     * @return definition tokens in order, or {@code [term]} when there is no definition
     */
    List<String> expand(String term);

    /**
     * Check whether the graph holds a non-empty definition for the term.
     */
    boolean contains(String term);

    /**
     * Number of defined terms.
     */
    int size();
}
