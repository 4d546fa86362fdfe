package pl.marcinmilkowski.word_diff.engine;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;
import java.util.Set;

/**
 * GD, WD and SD outcomes for one seed pair, with the outer paths of the terminated runs.
 */
public record PairEvaluation(
    String seedA,
    String seedB,
    GreatDifferentiationResult great,
    DifferentiationResult weak,
    DifferentiationResult strong,
    Set<List<String>> weakOuterPaths,
    Set<List<String>> strongOuterPaths
) {

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("seed_a", seedA);
        obj.put("seed_b", seedB);
        obj.put("gd", great.toJson());

        JSONObject wd = weak.toJson();
        wd.put("outer_paths", pathsToJson(weakOuterPaths));
        obj.put("wd", wd);

        JSONObject sd = strong.toJson();
        sd.put("outer_paths", pathsToJson(strongOuterPaths));
        obj.put("sd", sd);
        return obj;
    }

    private static JSONArray pathsToJson(Set<List<String>> paths) {
        JSONArray array = new JSONArray();
        for (List<String> path : paths) {
            array.add(new JSONArray(path));
        }
        return array;
    }
}
