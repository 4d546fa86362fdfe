package pl.marcinmilkowski.word_diff.config;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.word_diff.engine.AccumulationStrategy;

import java.util.Locale;

/**
 * Engine settings shared by every run.
 *
 * @param version         config format version
 * @param maxLevel        safety ceiling on the level loop; GD's cap normally sits well below it
 * @param timeLimitMillis wall-clock cap per run, 0 disables it
 * @param accumulation    how cumulative counts are maintained
 * @param recordTrace     record a per-level trace line in run results
 * @param computePaths    compute outer paths for terminated runs during pair evaluation
 */
public record EngineConfig(
    String version,
    int maxLevel,
    long timeLimitMillis,
    AccumulationStrategy accumulation,
    boolean recordTrace,
    boolean computePaths
) {

    public static final int DEFAULT_MAX_LEVEL = 10000;
    public static final long DEFAULT_TIME_LIMIT_MILLIS = 60_000L;

    public EngineConfig {
        if (maxLevel < 0) {
            throw new IllegalArgumentException("max_level must be non-negative: " + maxLevel);
        }
        if (timeLimitMillis < 0) {
            throw new IllegalArgumentException("time_limit_ms must be non-negative: " + timeLimitMillis);
        }
        if (accumulation == null) {
            throw new IllegalArgumentException("accumulation must be set");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig("1.0", DEFAULT_MAX_LEVEL, DEFAULT_TIME_LIMIT_MILLIS,
            AccumulationStrategy.RUNNING, false, true);
    }

    public EngineConfig withAccumulation(AccumulationStrategy strategy) {
        return new EngineConfig(version, maxLevel, timeLimitMillis, strategy, recordTrace, computePaths);
    }

    public EngineConfig withRecordTrace(boolean trace) {
        return new EngineConfig(version, maxLevel, timeLimitMillis, accumulation, trace, computePaths);
    }

    public EngineConfig withMaxLevel(int level) {
        return new EngineConfig(version, level, timeLimitMillis, accumulation, recordTrace, computePaths);
    }

    public EngineConfig withTimeLimitMillis(long millis) {
        return new EngineConfig(version, maxLevel, millis, accumulation, recordTrace, computePaths);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("version", version);
        obj.put("max_level", maxLevel);
        obj.put("time_limit_ms", timeLimitMillis);
        obj.put("accumulation", accumulation.name().toLowerCase(Locale.ROOT));
        obj.put("record_trace", recordTrace);
        obj.put("compute_paths", computePaths);
        return obj;
    }
}
