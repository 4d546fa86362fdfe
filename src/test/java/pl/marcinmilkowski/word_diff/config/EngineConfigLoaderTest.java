package pl.marcinmilkowski.word_diff.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.word_diff.engine.AccumulationStrategy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Bundled engine.json should match the built-in defaults")
    void testCreateDefault() {
        EngineConfigLoader loader = EngineConfigLoader.createDefault();

        assertEquals(EngineConfig.defaults(), loader.getConfig());
        assertEquals("classpath:/engine.json", loader.getSource());
    }

    @Test
    @DisplayName("All fields should be read from a config file")
    void testLoadFile() throws IOException {
        EngineConfig config = new EngineConfigLoader(Paths.get("src/test/resources/test-engine.json")).getConfig();

        assertEquals("test", config.version());
        assertEquals(50, config.maxLevel());
        assertEquals(0, config.timeLimitMillis());
        assertEquals(AccumulationStrategy.FULL_HISTORY, config.accumulation());
        assertTrue(config.recordTrace());
        assertTrue(config.computePaths());
    }

    @Test
    void testMissingVersion() throws IOException {
        Path file = tempDir.resolve("engine.json");
        Files.writeString(file, "{\"max_level\": 5}");
        assertThrows(IllegalArgumentException.class, () -> new EngineConfigLoader(file));
    }

    @Test
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfigLoader.parse("{\"version\": \"1\", \"max_level\": -1}", "inline"));
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfigLoader.parse("{\"version\": \"1\", \"time_limit_ms\": -5}", "inline"));
        assertThrows(IllegalArgumentException.class,
            () -> EngineConfigLoader.parse("{\"version\": \"1\", \"accumulation\": \"lazy\"}", "inline"));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> new EngineConfigLoader(tempDir.resolve("absent.json")));
    }

    @Test
    @DisplayName("toJson() should use snake_case keys")
    void testToJson() {
        EngineConfig config = EngineConfig.defaults();
        var json = config.toJson();

        assertEquals(10000, json.getIntValue("max_level"));
        assertEquals("running", json.getString("accumulation"));
        assertEquals(EngineConfig.defaults(), EngineConfigLoader.parse(json.toJSONString(), "round-trip"));
    }
}
