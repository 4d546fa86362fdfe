package pl.marcinmilkowski.word_diff.graph;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads a {@link MapDefinitionGraph} from a file.
 *
 * Supported formats, chosen by extension:
 * <ul>
 *   <li>{@code .json}: {"term": ["token", ...], "other": "token token"}</li>
 *   <li>{@code .tsv} / {@code .txt}: {@code term<TAB>token token ...} per line,
 *       blank lines and {@code #} comments skipped</li>
 * </ul>
 */
public class DefinitionGraphLoader {

    private static final Logger logger = LoggerFactory.getLogger(DefinitionGraphLoader.class);

    private DefinitionGraphLoader() {
    }

    /**
     * Load a graph, picking the format from the file extension.
     *
     * @throws IOException if the file is missing or unreadable
     * @throws IllegalArgumentException if the content or extension is invalid
     */
    public static MapDefinitionGraph load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Definition graph file not found: " + file);
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        MapDefinitionGraph graph;
        if (name.endsWith(".json")) {
            graph = loadJson(file);
        } else if (name.endsWith(".tsv") || name.endsWith(".txt")) {
            graph = loadTsv(file);
        } else {
            throw new IllegalArgumentException("Unsupported definition graph format: " + file);
        }
        logger.info("Loaded {} definitions from {}", graph.size(), file);
        return graph;
    }

    static MapDefinitionGraph loadJson(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed definition graph JSON in " + file, e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty definition graph JSON in " + file);
        }

        MapDefinitionGraph.Builder builder = MapDefinitionGraph.builder();
        for (Map.Entry<String, Object> entry : root.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof JSONArray array) {
                List<String> tokens = new ArrayList<>(array.size());
                for (int i = 0; i < array.size(); i++) {
                    tokens.add(array.getString(i));
                }
                builder.define(entry.getKey(), tokens);
            } else if (value instanceof String text) {
                builder.define(entry.getKey(), tokenize(text));
            } else if (value == null) {
                builder.define(entry.getKey(), List.of());
            } else {
                throw new IllegalArgumentException(
                    "Definition of '" + entry.getKey() + "' must be an array or a string in " + file);
            }
        }
        return builder.build();
    }

    static MapDefinitionGraph loadTsv(Path file) throws IOException {
        MapDefinitionGraph.Builder builder = MapDefinitionGraph.builder();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                int tab = line.indexOf('\t');
                if (tab < 0) {
                    builder.define(line, List.of());
                } else {
                    builder.define(line.substring(0, tab), tokenize(line.substring(tab + 1)));
                }
            }
        }
        return builder.build();
    }

    private static List<String> tokenize(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }
}
