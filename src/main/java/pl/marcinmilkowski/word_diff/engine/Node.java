package pl.marcinmilkowski.word_diff.engine;

/**
 * A produced term at a given level on a given side.
 */
public record Node(int level, Side side, String term) {

    @Override
    public String toString() {
        return "(" + level + "," + side + "," + term + ")";
    }
}
