package pl.marcinmilkowski.word_diff.engine;

import java.math.BigInteger;

/**
 * Decides whether a still-unique term at {@code (level, side)} is cancelled.
 *
 * <ul>
 *   <li>{@link #WEAK}: the term occurs more than once across all levels and both sides.</li>
 *   <li>{@link #STRONG}: the term occurs at least once anywhere on the opposite side.
 *       Same-side repetition never cancels.</li>
 * </ul>
 */
public enum RepetitionPolicy {

    WEAK("WD") {
        @Override
        public boolean cancels(CancellationAccumulator counts, Side side, String term) {
            return counts.globalCount(term).compareTo(BigInteger.ONE) > 0;
        }
    },

    STRONG("SD") {
        @Override
        public boolean cancels(CancellationAccumulator counts, Side side, String term) {
            return counts.sideCount(side.opposite(), term).signum() > 0;
        }
    };

    private final String abbreviation;

    RepetitionPolicy(String abbreviation) {
        this.abbreviation = abbreviation;
    }

    public abstract boolean cancels(CancellationAccumulator counts, Side side, String term);

    public String getAbbreviation() {
        return abbreviation;
    }
}
