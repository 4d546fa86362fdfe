package pl.marcinmilkowski.word_diff;

import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_diff.api.DifferentiationApiServer;
import pl.marcinmilkowski.word_diff.config.EngineConfig;
import pl.marcinmilkowski.word_diff.config.EngineConfigLoader;
import pl.marcinmilkowski.word_diff.engine.DifferentiationContext;
import pl.marcinmilkowski.word_diff.engine.DifferentiationResult;
import pl.marcinmilkowski.word_diff.engine.PairEvaluation;
import pl.marcinmilkowski.word_diff.engine.PairEvaluator;
import pl.marcinmilkowski.word_diff.graph.DefinitionGraph;
import pl.marcinmilkowski.word_diff.graph.DefinitionGraphLoader;
import pl.marcinmilkowski.word_diff.graph.DefinitionIndexer;
import pl.marcinmilkowski.word_diff.graph.LuceneDefinitionGraph;
import pl.marcinmilkowski.word_diff.graph.MapDefinitionGraph;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line entry point.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase(Locale.ROOT);

            switch (command) {
                case "index":
                    handleIndexCommand(args);
                    break;
                case "diff":
                    handleDiffCommand(args);
                    break;
                case "server":
                    handleServerCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static void handleIndexCommand(String[] args) throws IOException {
        String graphFile = null;
        String indexPath = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--graph":
                case "-g":
                    graphFile = args[++i];
                    break;
                case "--output":
                case "-o":
                    indexPath = args[++i];
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (graphFile == null || indexPath == null) {
            System.err.println("Error: --graph and --output are required");
            System.err.println("Usage: java -jar word-differentiation.jar index --graph <file> --output <dir>");
            return;
        }

        MapDefinitionGraph graph = DefinitionGraphLoader.load(Paths.get(graphFile));
        try (DefinitionIndexer indexer = new DefinitionIndexer(Paths.get(indexPath))) {
            long count = indexer.indexGraph(graph);
            System.out.println("Indexed " + count + " definitions into " + indexPath);
        }
    }

    private static void handleDiffCommand(String[] args) throws IOException {
        String graphPath = null;
        String configPath = null;
        String seedA = null;
        String seedB = null;
        boolean json = false;
        boolean trace = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--graph":
                case "-g":
                    graphPath = args[++i];
                    break;
                case "--config":
                case "-c":
                    configPath = args[++i];
                    break;
                case "--a":
                case "-a":
                    seedA = args[++i];
                    break;
                case "--b":
                case "-b":
                    seedB = args[++i];
                    break;
                case "--json":
                    json = true;
                    break;
                case "--trace":
                    trace = true;
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (graphPath == null || seedA == null || seedB == null) {
            System.err.println("Error: --graph, --a and --b are required");
            System.err.println("Usage: java -jar word-differentiation.jar diff --graph <file|index> --a <term> --b <term>");
            return;
        }

        EngineConfig config = loadConfig(configPath);
        if (trace) {
            config = config.withRecordTrace(true);
        }

        DefinitionGraph graph = openGraph(Paths.get(graphPath));
        try {
            PairEvaluator evaluator = new PairEvaluator(new DifferentiationContext(graph, config));
            PairEvaluation evaluation = evaluator.evaluate(seedA, seedB);
            if (json) {
                System.out.println(evaluation.toJson().toJSONString(JSONWriter.Feature.PrettyFormat));
            } else {
                printReport(evaluation, trace);
            }
        } finally {
            if (graph instanceof Closeable closeable) {
                closeable.close();
            }
        }
    }

    private static void handleServerCommand(String[] args) throws IOException {
        String graphPath = null;
        String configPath = null;
        int port = 8080;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--graph":
                case "-g":
                    graphPath = args[++i];
                    break;
                case "--config":
                case "-c":
                    configPath = args[++i];
                    break;
                case "--port":
                case "-p":
                    port = Integer.parseInt(args[++i]);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (graphPath == null) {
            System.err.println("Error: --graph is required");
            System.err.println("Usage: java -jar word-differentiation.jar server --graph <file|index> [--port <port>]");
            return;
        }

        DefinitionGraph graph = openGraph(Paths.get(graphPath));
        PairEvaluator evaluator = new PairEvaluator(new DifferentiationContext(graph, loadConfig(configPath)));
        DifferentiationApiServer server = DifferentiationApiServer.builder()
            .withEvaluator(evaluator)
            .withPort(port)
            .build();

        server.start();
        System.out.println("Press Ctrl+C to stop the server.");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            if (graph instanceof Closeable closeable) {
                try {
                    closeable.close();
                } catch (IOException e) {
                    logger.warn("Failed to close definition graph: {}", e.getMessage());
                }
            }
        }));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * A directory is read as a Lucene definition index, anything else as a graph file.
     */
    static DefinitionGraph openGraph(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            return new LuceneDefinitionGraph(path);
        }
        return DefinitionGraphLoader.load(path);
    }

    private static EngineConfig loadConfig(String configPath) throws IOException {
        if (configPath == null) {
            return EngineConfigLoader.createDefault().getConfig();
        }
        return new EngineConfigLoader(Paths.get(configPath)).getConfig();
    }

    private static void printReport(PairEvaluation evaluation, boolean trace) {
        System.out.println("Seeds: " + evaluation.seedA() + " / " + evaluation.seedB());
        System.out.println("GD: termination level " + evaluation.great().terminationLevel()
            + (evaluation.great().converged() ? "" : " (level cap reached)"));
        if (trace) {
            evaluation.great().trace().forEach(line -> System.out.println("  " + line));
        }
        printRun(evaluation.weak(), evaluation.weakOuterPaths(), trace);
        printRun(evaluation.strong(), evaluation.strongOuterPaths(), trace);
    }

    private static void printRun(DifferentiationResult result, Set<List<String>> outerPaths, boolean trace) {
        System.out.printf("%s: score=%d status=%s%n",
            result.getPolicy().getAbbreviation(), result.getScore(), result.getStatus());
        result.getDiagnostic().ifPresent(d ->
            System.out.printf("  closest level %d with %d unique occurrences left%n", d.level(), d.count()));
        if (trace) {
            result.getTrace().forEach(line -> System.out.println("  " + line));
        }
        for (List<String> path : outerPaths) {
            System.out.println("  path: " + String.join(" -> ", path));
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar word-differentiation.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  index   Build a Lucene definition index from a graph file");
        System.out.println("          --graph <file.json|file.tsv> --output <dir>");
        System.out.println("  diff    Differentiate two terms (GD, WD, SD)");
        System.out.println("          --graph <file|index> --a <term> --b <term> [--config <engine.json>] [--json] [--trace]");
        System.out.println("  server  Start the HTTP API");
        System.out.println("          --graph <file|index> [--port <port>] [--config <engine.json>]");
        System.out.println("  help    Show this message");
    }
}
