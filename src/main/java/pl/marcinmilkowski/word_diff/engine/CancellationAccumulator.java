package pl.marcinmilkowski.word_diff.engine;

import java.math.BigInteger;

/**
 * Cumulative expansion counts over levels {@code [0, current]}, per side.
 *
 * <p>{@link #update(LevelHistory, int)} is called once per level, in increasing level
 * order, before the cancellation sweep of that level.</p>
 */
public interface CancellationAccumulator {

    void update(LevelHistory history, int level);

    /**
     * {@code Σ E[l, side][term]} over the accumulated levels.
     */
    BigInteger sideCount(Side side, String term);

    /**
     * {@code Σ E[l, s][term]} over the accumulated levels and both sides.
     */
    default BigInteger globalCount(String term) {
        return sideCount(Side.A, term).add(sideCount(Side.B, term));
    }
}
