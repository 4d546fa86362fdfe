package pl.marcinmilkowski.word_diff.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_diff.graph.TermNormalizer;
import pl.marcinmilkowski.word_diff.paths.PathReconstructor;

import java.util.List;
import java.util.Set;

/**
 * Evaluates one seed pair: GD first to find the level cap, then WD and SD under that cap.
 *
 * <p>Holds only the immutable context, so one evaluator can be shared by worker threads.</p>
 */
public class PairEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(PairEvaluator.class);

    private final DifferentiationContext context;

    public PairEvaluator(DifferentiationContext context) {
        this.context = context;
    }

    /**
     * Normalize and evaluate a pair.
     *
     * @throws IllegalArgumentException if either seed is blank after normalization
     */
    public PairEvaluation evaluate(String rawA, String rawB) {
        String seedA = TermNormalizer.normalize(rawA);
        String seedB = TermNormalizer.normalize(rawB);
        if (seedA.isEmpty() || seedB.isEmpty()) {
            throw new IllegalArgumentException("Seeds must not be blank: '" + rawA + "', '" + rawB + "'");
        }

        GreatDifferentiationResult great = context.greatDifferentiation()
            .run(seedA, seedB, context.config().maxLevel());
        int cap = great.terminationLevel();

        DifferentiationResult weak = context.run(RepetitionPolicy.WEAK).run(seedA, seedB, cap);
        DifferentiationResult strong = context.run(RepetitionPolicy.STRONG).run(seedA, seedB, cap);

        logger.info("{} / {}: GD level {}, {}, {}", seedA, seedB, cap, weak, strong);

        return new PairEvaluation(seedA, seedB, great, weak, strong,
            outerPaths(weak, seedA, seedB), outerPaths(strong, seedA, seedB));
    }

    private Set<List<String>> outerPaths(DifferentiationResult result, String seedA, String seedB) {
        if (!context.config().computePaths()) {
            return Set.of();
        }
        return result.getProvenanceForest()
            .map(forest -> PathReconstructor.outerPaths(forest, seedA, seedB))
            .orElse(Set.of());
    }

    public DifferentiationContext getContext() {
        return context;
    }
}
