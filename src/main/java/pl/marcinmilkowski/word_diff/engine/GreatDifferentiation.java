package pl.marcinmilkowski.word_diff.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_diff.graph.DefinitionGraph;

import java.util.*;

/**
 * Great differentiation: one merged vocabulary, no sides.
 *
 * <p>Both seeds go into a single pool. Each level opens the terms that were newly
 * added (and survived) at the previous level, and classifies every produced word:</p>
 * <ul>
 *   <li>already repeated: stays repeated;</li>
 *   <li>already uncanceled, including earlier in the same level: moves to repeated;</li>
 *   <li>otherwise: newly uncanceled.</li>
 * </ul>
 * <p>The run stops at the first level that leaves no new uncanceled term (a fixed
 * point) or at {@code maxLevel}. The level reached is the cap used for the weak and
 * strong runs.</p>
 */
public class GreatDifferentiation {

    private static final Logger logger = LoggerFactory.getLogger(GreatDifferentiation.class);

    private final DefinitionGraph graph;

    public GreatDifferentiation(DefinitionGraph graph) {
        this.graph = graph;
    }

    public GreatDifferentiationResult run(String seedA, String seedB, int maxLevel) {
        if (maxLevel < 0) {
            throw new IllegalArgumentException("maxLevel must be non-negative: " + maxLevel);
        }
        Pool pool = new Pool();
        List<String> trace = new ArrayList<>();

        Set<String> fresh = new LinkedHashSet<>();
        pool.insert(seedA, fresh);
        pool.insert(seedB, fresh);
        fresh.retainAll(pool.uncanceled);
        trace.add(pool.describe(0, 0, fresh));

        if (fresh.isEmpty()) {
            return pool.result(0, true, trace);
        }

        for (int level = 1; level <= maxLevel; level++) {
            // a fresh term is new to the pool, so it has never been opened before
            Set<String> next = new LinkedHashSet<>();
            for (String term : fresh) {
                for (String word : graph.expand(term)) {
                    pool.insert(word, next);
                }
            }
            next.retainAll(pool.uncanceled);
            trace.add(pool.describe(level, fresh.size(), next));

            if (next.isEmpty()) {
                return pool.result(level, true, trace);
            }
            fresh = next;
        }

        logger.debug("GD {}/{} reached the level cap {}", seedA, seedB, maxLevel);
        return pool.result(maxLevel, false, trace);
    }

    private static final class Pool {
        final Set<String> repeated = new LinkedHashSet<>();
        final Set<String> uncanceled = new LinkedHashSet<>();

        void insert(String word, Set<String> fresh) {
            if (repeated.contains(word)) {
                return;
            }
            if (uncanceled.remove(word)) {
                repeated.add(word);
                return;
            }
            uncanceled.add(word);
            fresh.add(word);
        }

        String describe(int level, int openedCount, Set<String> fresh) {
            return String.format("level=%d opened=%d new=%s repeated=%d uncanceled=%d",
                level, openedCount, fresh, repeated.size(), uncanceled.size());
        }

        GreatDifferentiationResult result(int level, boolean converged, List<String> trace) {
            return new GreatDifferentiationResult(level, converged,
                Collections.unmodifiableSet(new LinkedHashSet<>(repeated)),
                Collections.unmodifiableSet(new LinkedHashSet<>(uncanceled)),
                List.copyOf(trace));
        }
    }
}
