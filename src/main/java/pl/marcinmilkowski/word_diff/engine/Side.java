package pl.marcinmilkowski.word_diff.engine;

/**
 * The two seeds being differentiated.
 */
public enum Side {
    A, B;

    public Side opposite() {
        return this == A ? B : A;
    }
}
