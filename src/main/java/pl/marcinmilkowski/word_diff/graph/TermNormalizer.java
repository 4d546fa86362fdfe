package pl.marcinmilkowski.word_diff.graph;

import java.util.Locale;

/**
 * Case-folds and trims vocabulary terms.
 *
 * All terms entering the graph or the engine go through here, so equality of
 * terms is plain string equality after normalization.
 */
public final class TermNormalizer {

    private TermNormalizer() {
    }

    /**
     * Normalize a term: lower-case (root locale), then trim.
     * {@code null} becomes the empty string.
     */
    public static String normalize(String term) {
        if (term == null) return "";
        return term.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Check if a term is empty after normalization.
     */
    public static boolean isBlank(String term) {
        return normalize(term).isEmpty();
    }
}
