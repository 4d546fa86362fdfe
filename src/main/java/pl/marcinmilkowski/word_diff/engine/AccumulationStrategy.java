package pl.marcinmilkowski.word_diff.engine;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * How the cumulative counts used by the cancellation policies are maintained.
 *
 * <p>Both strategies yield the same counts and therefore the same cancellation
 * decisions. {@link #FULL_HISTORY} recomputes the sums from every recorded level at
 * each step (quadratic in the number of levels); {@link #RUNNING} only folds in the
 * newest level.</p>
 */
public enum AccumulationStrategy {

    FULL_HISTORY {
        @Override
        public CancellationAccumulator newAccumulator() {
            return new FullHistoryAccumulator();
        }
    },

    RUNNING {
        @Override
        public CancellationAccumulator newAccumulator() {
            return new RunningAccumulator();
        }
    };

    public abstract CancellationAccumulator newAccumulator();

    public static AccumulationStrategy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Accumulation strategy must not be null");
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "FULL_HISTORY", "FULL" -> FULL_HISTORY;
            case "RUNNING" -> RUNNING;
            default -> throw new IllegalArgumentException("Unknown accumulation strategy: " + value);
        };
    }

    private static void fold(Map<Side, Map<String, BigInteger>> sums, LevelHistory history, int level) {
        for (Side side : Side.values()) {
            Map<String, BigInteger> target = sums.get(side);
            for (Map.Entry<String, BigInteger> entry : history.expansion(level, side).entrySet()) {
                target.merge(entry.getKey(), entry.getValue(), BigInteger::add);
            }
        }
    }

    private static EnumMap<Side, Map<String, BigInteger>> emptySums() {
        EnumMap<Side, Map<String, BigInteger>> sums = new EnumMap<>(Side.class);
        sums.put(Side.A, new HashMap<>());
        sums.put(Side.B, new HashMap<>());
        return sums;
    }

    private static final class FullHistoryAccumulator implements CancellationAccumulator {
        private EnumMap<Side, Map<String, BigInteger>> sums = emptySums();

        @Override
        public void update(LevelHistory history, int level) {
            EnumMap<Side, Map<String, BigInteger>> fresh = emptySums();
            for (int l = 0; l <= level; l++) {
                fold(fresh, history, l);
            }
            sums = fresh;
        }

        @Override
        public BigInteger sideCount(Side side, String term) {
            return sums.get(side).getOrDefault(term, BigInteger.ZERO);
        }
    }

    private static final class RunningAccumulator implements CancellationAccumulator {
        private final EnumMap<Side, Map<String, BigInteger>> sums = emptySums();
        private int lastLevel = -1;

        @Override
        public void update(LevelHistory history, int level) {
            if (level != lastLevel + 1) {
                throw new IllegalStateException(
                    "Running accumulator expects level " + (lastLevel + 1) + " but got " + level);
            }
            fold(sums, history, level);
            lastLevel = level;
        }

        @Override
        public BigInteger sideCount(Side side, String term) {
            return sums.get(side).getOrDefault(term, BigInteger.ZERO);
        }
    }
}
