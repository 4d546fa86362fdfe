package pl.marcinmilkowski.word_diff.engine;

import java.math.BigInteger;
import java.util.*;

/**
 * Term to count multiset that remembers first-insertion order.
 *
 * <p>Iteration order is the order in which terms were first added, never hash
 * order, so everything derived from walking a multiset (parent links, cancellation
 * sweeps) is reproducible.</p>
 *
 * <p>Counts are non-negative and unbounded: they grow exponentially with the level
 * on fanning-out graphs, so they are held as {@link BigInteger}. Adding a negative
 * count is an implementation defect and fails immediately.</p>
 */
public final class ExpansionMultiset {

    private final LinkedHashMap<String, BigInteger> counts;

    public ExpansionMultiset() {
        this.counts = new LinkedHashMap<>();
    }

    private ExpansionMultiset(LinkedHashMap<String, BigInteger> counts) {
        this.counts = counts;
    }

    public static ExpansionMultiset of(String term, long count) {
        ExpansionMultiset multiset = new ExpansionMultiset();
        multiset.add(term, count);
        return multiset;
    }

    public void add(String term, long count) {
        add(term, BigInteger.valueOf(count));
    }

    /**
     * Add {@code count} occurrences of {@code term}.
     *
     * @throws IllegalStateException if count is negative
     */
    public void add(String term, BigInteger count) {
        if (count.signum() < 0) {
            throw new IllegalStateException("Negative count " + count + " for term '" + term + "'");
        }
        counts.merge(term, count, BigInteger::add);
    }

    /**
     * Remove a term entirely.
     *
     * @return the count it had, 0 if absent
     */
    public BigInteger remove(String term) {
        BigInteger removed = counts.remove(term);
        return removed == null ? BigInteger.ZERO : removed;
    }

    public BigInteger count(String term) {
        return counts.getOrDefault(term, BigInteger.ZERO);
    }

    public boolean contains(String term) {
        return counts.containsKey(term);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Number of distinct terms.
     */
    public int distinct() {
        return counts.size();
    }

    /**
     * Sum of all counts.
     */
    public BigInteger total() {
        BigInteger total = BigInteger.ZERO;
        for (BigInteger c : counts.values()) {
            total = total.add(c);
        }
        return total;
    }

    /**
     * Terms in first-insertion order, snapshotted so callers may mutate the multiset while iterating.
     */
    public List<String> terms() {
        return new ArrayList<>(counts.keySet());
    }

    public Map<String, BigInteger> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    public ExpansionMultiset copy() {
        return new ExpansionMultiset(new LinkedHashMap<>(counts));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpansionMultiset other)) return false;
        return counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
