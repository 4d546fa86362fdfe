package pl.marcinmilkowski.word_diff.engine;

/**
 * How a differentiation run ended.
 *
 * @param kind  terminated (some unique set emptied) or exhausted (level cap reached)
 * @param level termination level, or the last level evaluated when exhausted
 */
public record RunStatus(Kind kind, int level) {

    public enum Kind { TERMINATED, EXHAUSTED }

    public static RunStatus terminatedAt(int level) {
        return new RunStatus(Kind.TERMINATED, level);
    }

    public static RunStatus exhausted(int lastLevel) {
        return new RunStatus(Kind.EXHAUSTED, lastLevel);
    }

    public boolean isTerminated() {
        return kind == Kind.TERMINATED;
    }

    @Override
    public String toString() {
        return isTerminated() ? "TerminatedAtLevel(" + level + ")" : "Exhausted";
    }
}
