package pl.marcinmilkowski.word_diff.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_diff.engine.AccumulationStrategy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link EngineConfig} from JSON.
 *
 * Expected JSON structure (only "version" is required):
 * {
 *   "version": "1.0",
 *   "max_level": 10000,
 *   "time_limit_ms": 60000,
 *   "accumulation": "running",
 *   "record_trace": false,
 *   "compute_paths": true
 * }
 */
public class EngineConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfigLoader.class);

    static final String DEFAULT_RESOURCE = "/engine.json";

    private final EngineConfig config;
    private final String source;

    /**
     * Load engine configuration from the specified path.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public EngineConfigLoader(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Engine config file not found: " + configPath);
        }
        this.source = configPath.toString();
        this.config = parse(Files.readString(configPath, StandardCharsets.UTF_8), source);
        logger.info("Loaded engine config version {} from {}", config.version(), source);
    }

    private EngineConfigLoader(String content, String source) {
        this.source = source;
        this.config = parse(content, source);
        logger.info("Loaded engine config version {} from {}", config.version(), source);
    }

    /**
     * Load the engine config bundled on the classpath.
     */
    public static EngineConfigLoader createDefault() {
        try (InputStream in = EngineConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return new EngineConfigLoader(new String(in.readAllBytes(), StandardCharsets.UTF_8),
                "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    static EngineConfig parse(String content, String source) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed engine config in " + source, e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty engine config in " + source);
        }

        String version = root.getString("version");
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in engine config");
        }

        EngineConfig defaults = EngineConfig.defaults();
        String accumulation = root.getString("accumulation");

        return new EngineConfig(
            version,
            root.getIntValue("max_level", defaults.maxLevel()),
            root.getLongValue("time_limit_ms", defaults.timeLimitMillis()),
            accumulation == null ? defaults.accumulation() : AccumulationStrategy.fromString(accumulation),
            root.getBooleanValue("record_trace", defaults.recordTrace()),
            root.getBooleanValue("compute_paths", defaults.computePaths())
        );
    }

    public EngineConfig getConfig() {
        return config;
    }

    public String getSource() {
        return source;
    }
}
