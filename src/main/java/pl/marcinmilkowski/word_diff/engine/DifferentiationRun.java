package pl.marcinmilkowski.word_diff.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_diff.config.EngineConfig;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Level loop driving weak or strong differentiation of two seeds to completion.
 *
 * <h2>Per level</h2>
 * <ol>
 *   <li>Expand {@code E[level-1, side]} for both sides, recording first producers as parents.</li>
 *   <li>Start {@code U[level, side]} as a copy of the expansion, {@code R[level, side]} empty.</li>
 *   <li>Apply the policy over the whole history.</li>
 *   <li>Stop as soon as any {@code U[l, side]}, {@code l <= level}, is empty.</li>
 * </ol>
 *
 * <p>If no unique set empties by {@code maxLevel} the run is {@link RunStatus.Kind#EXHAUSTED};
 * the result then carries a diagnostic but no provenance forest.</p>
 *
 * <p>Instances hold no per-run state; {@link #run} can be called concurrently.</p>
 */
public class DifferentiationRun {

    private static final Logger logger = LoggerFactory.getLogger(DifferentiationRun.class);

    private final RepetitionPolicy policy;
    private final EngineConfig config;
    private final LevelExpansionEngine expansionEngine;

    public DifferentiationRun(DifferentiationContext context, RepetitionPolicy policy) {
        this.policy = policy;
        this.config = context.config();
        this.expansionEngine = new LevelExpansionEngine(context.graph());
    }

    public DifferentiationResult run(String seedA, String seedB, int maxLevel) {
        return run(seedA, seedB, maxLevel, RunObserver.NONE);
    }

    /**
     * Differentiate two normalized seeds.
     *
     * @param maxLevel level cap, clamped to the configured ceiling
     * @param observer called after the policy has been applied at every level
     */
    public DifferentiationResult run(String seedA, String seedB, int maxLevel, RunObserver observer) {
        if (maxLevel < 0) {
            throw new IllegalArgumentException("maxLevel must be non-negative: " + maxLevel);
        }
        int cap = Math.min(maxLevel, config.maxLevel());
        boolean timeLimited = config.timeLimitMillis() > 0;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.timeLimitMillis());

        LevelHistory history = new LevelHistory();
        RepetitionDetector detector = new RepetitionDetector(policy, config.accumulation());
        ProvenanceForest.Builder forest = ProvenanceForest.builder();
        List<String> trace = new ArrayList<>();

        history.addLevel(ExpansionMultiset.of(seedA, 1), ExpansionMultiset.of(seedB, 1));
        forest.root(new Node(0, Side.A, seedA));
        forest.root(new Node(0, Side.B, seedB));

        if (finishLevel(history, detector, 0, observer, trace)) {
            return terminated(history, 0, forest, trace);
        }

        int level = 1;
        for (; level <= cap; level++) {
            if (timeLimited && System.nanoTime() - deadline > 0) {
                logger.warn("{} run {}/{} hit the time limit of {} ms at level {}",
                    policy.getAbbreviation(), seedA, seedB, config.timeLimitMillis(), level);
                break;
            }

            ExpansionMultiset[] expanded = new ExpansionMultiset[2];
            for (Side side : Side.values()) {
                LevelExpansionEngine.Expansion step =
                    expansionEngine.expandWithProducers(history.expansionSet(level - 1, side));
                for (Map.Entry<String, String> link : step.producers().entrySet()) {
                    forest.link(new Node(level, side, link.getKey()), new Node(level - 1, side, link.getValue()));
                }
                expanded[side.ordinal()] = step.multiset();
            }
            history.addLevel(expanded[0], expanded[1]);

            if (finishLevel(history, detector, level, observer, trace)) {
                return terminated(history, level, forest, trace);
            }
        }

        return exhausted(history, level - 1, trace);
    }

    private boolean finishLevel(LevelHistory history, RepetitionDetector detector, int level,
                                RunObserver observer, List<String> trace) {
        detector.detect(history, level);
        observer.onLevel(level, history);
        if (config.recordTrace()) {
            trace.add(String.format("level=%d |U[A]|=%d |U[B]|=%d |R|=%d", level,
                history.unique(level, Side.A).size(), history.unique(level, Side.B).size(),
                history.repeatedTotal()));
        }
        return history.anyUniqueEmpty();
    }

    private DifferentiationResult terminated(LevelHistory history, int level,
                                             ProvenanceForest.Builder forest, List<String> trace) {
        BigInteger score = history.score();
        logger.debug("{} terminated at level {} with score {}", policy.getAbbreviation(), level, score);
        return new DifferentiationResult(policy, score, RunStatus.terminatedAt(level), null, forest.build(), trace);
    }

    private DifferentiationResult exhausted(LevelHistory history, int lastLevel, List<String> trace) {
        DifferentiationResult.Diagnostic diagnostic = null;
        for (int level = 1; level <= lastLevel; level++) {
            BigInteger count = history.uniqueTotal(level);
            if (diagnostic == null || count.compareTo(diagnostic.count()) < 0) {
                diagnostic = new DifferentiationResult.Diagnostic(level, count);
            }
        }
        BigInteger score = history.score();
        logger.debug("{} exhausted after level {} with score {}", policy.getAbbreviation(), lastLevel, score);
        return new DifferentiationResult(policy, score, RunStatus.exhausted(lastLevel), diagnostic, null, trace);
    }

    public RepetitionPolicy getPolicy() {
        return policy;
    }
}
