package pl.marcinmilkowski.word_diff.engine;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link GreatDifferentiation}.
 *
 * @param terminationLevel level at which the merged pool stopped growing, or the cap
 * @param converged        false when the cap was hit before a fixed point
 * @param repeated         terms seen more than once, in first-repetition order
 * @param uncanceled       terms seen exactly once
 * @param trace            one human-readable line per level
 */
public record GreatDifferentiationResult(
    int terminationLevel,
    boolean converged,
    Set<String> repeated,
    Set<String> uncanceled,
    List<String> trace
) {

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("termination_level", terminationLevel);
        obj.put("converged", converged);
        obj.put("repeated", repeated.size());
        obj.put("uncanceled", uncanceled.size());
        obj.put("trace", new JSONArray(trace));
        return obj;
    }
}
