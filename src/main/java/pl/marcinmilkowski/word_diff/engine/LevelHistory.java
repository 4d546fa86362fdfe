package pl.marcinmilkowski.word_diff.engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-level, per-side bookkeeping of one differentiation run.
 *
 * <p>For every level and side it keeps the expansion multiset {@code E}, the
 * still-unique part {@code U} and the cancelled part {@code R}. {@code U} starts as a
 * copy of {@code E} and only shrinks; whatever leaves it lands in {@code R}.</p>
 *
 * <p>Mutators are package-private: observers get a read-only view through the public
 * accessors.</p>
 */
public final class LevelHistory {

    private final List<EnumMap<Side, ExpansionMultiset>> expansions = new ArrayList<>();
    private final List<EnumMap<Side, ExpansionMultiset>> unique = new ArrayList<>();
    private final List<EnumMap<Side, ExpansionMultiset>> repeated = new ArrayList<>();

    /**
     * Append the next level from the two sides' expansions.
     *
     * @return index of the new level
     */
    int addLevel(ExpansionMultiset sideA, ExpansionMultiset sideB) {
        EnumMap<Side, ExpansionMultiset> e = new EnumMap<>(Side.class);
        e.put(Side.A, sideA);
        e.put(Side.B, sideB);
        EnumMap<Side, ExpansionMultiset> u = new EnumMap<>(Side.class);
        u.put(Side.A, sideA.copy());
        u.put(Side.B, sideB.copy());
        EnumMap<Side, ExpansionMultiset> r = new EnumMap<>(Side.class);
        r.put(Side.A, new ExpansionMultiset());
        r.put(Side.B, new ExpansionMultiset());
        expansions.add(e);
        unique.add(u);
        repeated.add(r);
        return expansions.size() - 1;
    }

    /**
     * Move every occurrence of {@code term} at {@code (level, side)} from U to R.
     *
     * @return the count moved, 0 if the term was not in U
     */
    BigInteger cancel(int level, Side side, String term) {
        BigInteger count = unique.get(level).get(side).remove(term);
        if (count.signum() > 0) {
            repeated.get(level).get(side).add(term, count);
        }
        return count;
    }

    ExpansionMultiset expansionSet(int level, Side side) {
        return expansions.get(level).get(side);
    }

    ExpansionMultiset uniqueSet(int level, Side side) {
        return unique.get(level).get(side);
    }

    /**
     * Number of recorded levels (the highest level is {@code levelCount() - 1}).
     */
    public int levelCount() {
        return expansions.size();
    }

    public Map<String, BigInteger> expansion(int level, Side side) {
        return expansions.get(level).get(side).asMap();
    }

    public Map<String, BigInteger> unique(int level, Side side) {
        return unique.get(level).get(side).asMap();
    }

    public Map<String, BigInteger> repeated(int level, Side side) {
        return repeated.get(level).get(side).asMap();
    }

    /**
     * {@code |U[level,A]| + |U[level,B]|}, counted with multiplicity.
     */
    public BigInteger uniqueTotal(int level) {
        return unique.get(level).get(Side.A).total().add(unique.get(level).get(Side.B).total());
    }

    public BigInteger repeatedTotal() {
        BigInteger total = BigInteger.ZERO;
        for (EnumMap<Side, ExpansionMultiset> level : repeated) {
            for (ExpansionMultiset r : level.values()) {
                total = total.add(r.total());
            }
        }
        return total;
    }

    /**
     * Check whether any recorded {@code U[level, side]} has been emptied.
     */
    public boolean anyUniqueEmpty() {
        for (EnumMap<Side, ExpansionMultiset> level : unique) {
            for (ExpansionMultiset u : level.values()) {
                if (u.isEmpty()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Sum over every cancelled {@code (level, side, term)} of {@code level * count}.
     */
    public BigInteger score() {
        BigInteger score = BigInteger.ZERO;
        for (int level = 1; level < repeated.size(); level++) {
            BigInteger weight = BigInteger.valueOf(level);
            for (ExpansionMultiset r : repeated.get(level).values()) {
                score = score.add(weight.multiply(r.total()));
            }
        }
        return score;
    }
}
