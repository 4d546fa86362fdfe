package pl.marcinmilkowski.word_diff.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.word_diff.engine.PairEvaluation;
import pl.marcinmilkowski.word_diff.engine.PairEvaluator;
import pl.marcinmilkowski.word_diff.graph.DefinitionGraph;
import pl.marcinmilkowski.word_diff.graph.TermNormalizer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * REST API server for differentiation queries.
 *
 * Endpoints:
 * - GET /health - Health check
 * - GET /api/differentiate?a=money&b=business - GD, WD and SD for a seed pair
 * - GET /api/expand?term=money - Definition tokens of a term
 * - GET /api/config - Active engine configuration
 */
public class DifferentiationApiServer {

    private static final Logger logger = LoggerFactory.getLogger(DifferentiationApiServer.class);

    private final PairEvaluator evaluator;
    private final int port;
    private HttpServer server;

    public DifferentiationApiServer(PairEvaluator evaluator, int port) {
        this.evaluator = evaluator;
        this.port = port;
    }

    /**
     * Start the API server. Port 0 binds an ephemeral port, see {@link #getPort()}.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", wrapHandler(this::handleHealth));
        server.createContext("/api/differentiate", wrapHandler(this::handleDifferentiate));
        server.createContext("/api/expand", wrapHandler(this::handleExpand));
        server.createContext("/api/config", wrapHandler(this::handleConfig));
        server.setExecutor(null);
        server.start();
        logger.info("API server started on http://localhost:{}", getPort());
        logger.info("Endpoints:");
        logger.info("  GET  /health                 - Health check");
        logger.info("  GET  /api/differentiate?a=&b= - Differentiate a seed pair");
        logger.info("  GET  /api/expand?term=       - Definition of a term");
        logger.info("  GET  /api/config             - Active engine configuration");
    }

    /**
     * Stop the API server.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            logger.info("API server stopped");
        }
    }

    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Wrap a handler to catch all exceptions and return JSON error.
     */
    private HttpHandler wrapHandler(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (Exception e) {
                logger.error("Unhandled exception on {}", exchange.getRequestURI(), e);
                if (exchange.getResponseCode() != -1) {
                    logger.warn("Cannot send error response: headers already sent");
                    exchange.close();
                    return;
                }
                sendError(exchange, 500, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            } finally {
                exchange.close();
            }
        };
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        JSONObject response = new JSONObject();
        response.put("status", "ok");
        response.put("service", "word-differentiation");
        response.put("terms", evaluator.getContext().graph().size());
        sendJson(exchange, 200, response);
    }

    private void handleDifferentiate(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String a = params.get("a");
        String b = params.get("b");
        if (TermNormalizer.isBlank(a) || TermNormalizer.isBlank(b)) {
            sendError(exchange, 400, "Parameters 'a' and 'b' are required");
            return;
        }

        PairEvaluation evaluation = evaluator.evaluate(a, b);
        JSONObject response = evaluation.toJson();
        response.put("status", "ok");
        sendJson(exchange, 200, response);
    }

    private void handleExpand(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String term = TermNormalizer.normalize(params.get("term"));
        if (term.isEmpty()) {
            sendError(exchange, 400, "Parameter 'term' is required");
            return;
        }

        DefinitionGraph graph = evaluator.getContext().graph();
        JSONObject response = new JSONObject();
        response.put("status", "ok");
        response.put("term", term);
        response.put("defined", graph.contains(term));
        response.put("definition", new JSONArray(graph.expand(term)));
        sendJson(exchange, 200, response);
    }

    private void handleConfig(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        JSONObject response = new JSONObject();
        response.put("status", "ok");
        response.put("config", evaluator.getContext().config().toJson());
        sendJson(exchange, 200, response);
    }

    private Map<String, String> parseQueryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            String[] keyValue = pair.split("=", 2);
            if (keyValue.length == 2) {
                params.put(
                    URLDecoder.decode(keyValue[0], StandardCharsets.UTF_8).toLowerCase(Locale.ROOT),
                    URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private void sendJson(HttpExchange exchange, int status, Map<String, Object> data) throws IOException {
        String json = JSON.toJSONString(data, JSONWriter.Feature.WriteMapNullValue);
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, Object> error = new HashMap<>();
        error.put("status", "error");
        error.put("message", message);
        error.put("code", status);
        sendJson(exchange, status, error);
    }

    /**
     * Builder for the API server.
     */
    public static class Builder {
        private PairEvaluator evaluator;
        private int port = 8080;

        public Builder withEvaluator(PairEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public DifferentiationApiServer build() {
            if (evaluator == null) {
                throw new IllegalStateException("An evaluator is required");
            }
            return new DifferentiationApiServer(evaluator, port);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
