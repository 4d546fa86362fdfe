package pl.marcinmilkowski.word_diff.graph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Test helper with the small definition graphs used across the test suite.
 */
public class TestGraphs {

    private static final Path GRAPHS = Paths.get("src/test/resources/graphs");

    /**
     * money -> [business, debt], business -> [money, trade]
     */
    public static MapDefinitionGraph moneyBusiness() {
        return load("money-business.json");
    }

    /**
     * a -> [x], x -> [c], b -> [y], y -> [c]
     */
    public static MapDefinitionGraph bridge() {
        return load("bridge.tsv");
    }

    public static MapDefinitionGraph empty() {
        return MapDefinitionGraph.builder().build();
    }

    public static MapDefinitionGraph load(String name) {
        try {
            return DefinitionGraphLoader.load(GRAPHS.resolve(name));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load test graph " + name, e);
        }
    }
}
