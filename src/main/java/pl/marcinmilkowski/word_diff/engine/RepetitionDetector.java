package pl.marcinmilkowski.word_diff.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link RepetitionPolicy} over the whole recorded history.
 *
 * <p>Every level {@code l <= current} is swept again, not just the newest one: a term
 * recorded as unique at an early level is cancelled retroactively once a later level
 * satisfies the policy.</p>
 *
 * <p>One detector belongs to one run; its accumulator is stateful.</p>
 */
public class RepetitionDetector {

    private static final Logger logger = LoggerFactory.getLogger(RepetitionDetector.class);

    private final RepetitionPolicy policy;
    private final CancellationAccumulator counts;

    public RepetitionDetector(RepetitionPolicy policy, AccumulationStrategy strategy) {
        this.policy = policy;
        this.counts = strategy.newAccumulator();
    }

    /**
     * Fold level {@code current} into the cumulative counts and cancel every term the policy rejects.
     *
     * @return number of {@code (level, side, term)} entries moved from U to R
     */
    public int detect(LevelHistory history, int current) {
        counts.update(history, current);
        int moved = 0;
        for (int level = 0; level <= current; level++) {
            for (Side side : Side.values()) {
                ExpansionMultiset u = history.uniqueSet(level, side);
                for (String term : u.terms()) {
                    if (policy.cancels(counts, side, term)) {
                        history.cancel(level, side, term);
                        moved++;
                    }
                }
            }
        }
        logger.debug("{} at level {}: cancelled {} entries", policy.getAbbreviation(), current, moved);
        return moved;
    }

    public RepetitionPolicy getPolicy() {
        return policy;
    }
}
