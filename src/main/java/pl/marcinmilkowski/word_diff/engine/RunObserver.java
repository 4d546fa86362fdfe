package pl.marcinmilkowski.word_diff.engine;

/**
 * Called after the cancellation policy has been applied at each level of a run.
 * The history must not be retained past the call.
 */
@FunctionalInterface
public interface RunObserver {

    RunObserver NONE = (level, history) -> { };

    void onLevel(int level, LevelHistory history);
}
