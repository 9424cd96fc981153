package pl.marcinmilkowski.ldsi.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.cleaning.CleanerConfig;
import pl.marcinmilkowski.ldsi.cleaning.TextCleaner;
import pl.marcinmilkowski.ldsi.config.LdsiCoefficients;
import pl.marcinmilkowski.ldsi.config.LdsiConfig;
import pl.marcinmilkowski.ldsi.entropy.EntropyAnalyzer;
import pl.marcinmilkowski.ldsi.entropy.EntropyComparison;
import pl.marcinmilkowski.ldsi.entropy.EntropyMeasurement;
import pl.marcinmilkowski.ldsi.entropy.WordTokenizer;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;
import pl.marcinmilkowski.ldsi.graph.CooccurrenceGraph;
import pl.marcinmilkowski.ldsi.graph.CooccurrenceGraphBuilder;
import pl.marcinmilkowski.ldsi.graph.StructuralScoring;
import pl.marcinmilkowski.ldsi.graph.TopologyAnalyzer;
import pl.marcinmilkowski.ldsi.graph.TopologyMetrics;
import pl.marcinmilkowski.ldsi.ncd.CompressionMeasurement;
import pl.marcinmilkowski.ldsi.ncd.NcdCalculator;
import pl.marcinmilkowski.ldsi.scoring.LdsiResult;
import pl.marcinmilkowski.ldsi.scoring.LdsiScorer;
import pl.marcinmilkowski.ldsi.viz.GraphSvgRenderer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API server for LDSI scoring.
 *
 * Endpoints:
 * - GET  /health            - Health check
 * - GET  /api/config        - Active coefficients, thresholds and structural scoring
 * - POST /api/ldsi          - Full score of {"text_a", "text_b"}
 * - POST /api/ncd           - Compression distance only
 * - POST /api/entropy       - Entropy comparison only
 * - POST /api/topology      - Metrics, nodes and edges of {"text"}
 * - POST /api/topology/svg  - Force-directed SVG of {"text"}
 *
 * POST /api/ldsi also accepts "coefficients", "structural_scoring" and
 * "clean" (run both texts through the {@link TextCleaner} first).
 */
public class LdsiApiServer {

    private static final Logger logger = LoggerFactory.getLogger(LdsiApiServer.class);

    static final int DEFAULT_SVG_WIDTH = 900;
    static final int DEFAULT_SVG_HEIGHT = 700;
    static final int MAX_SVG_SIZE = 4000;

    private final LdsiConfig config;
    private final int port;
    private com.sun.net.httpserver.HttpServer server;

    public LdsiApiServer(LdsiConfig config, int port) {
        if (config == null) {
            throw InvalidInputException.missing("config");
        }
        this.config = config;
        this.port = port;
    }

    /**
     * Start the API server.
     */
    public void start() throws IOException {
        server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", wrapHandler(this::handleHealth));
        server.createContext("/api/config", wrapHandler(this::handleConfig));
        server.createContext("/api/ldsi", wrapHandler(this::handleLdsi));
        server.createContext("/api/ncd", wrapHandler(this::handleNcd));
        server.createContext("/api/entropy", wrapHandler(this::handleEntropy));
        server.createContext("/api/topology", wrapHandler(this::handleTopology));
        server.createContext("/api/topology/svg", wrapHandler(this::handleTopologySvg));

        server.setExecutor(null);
        server.start();
        logger.info("API server started on http://localhost:{}", getPort());
        logger.info("Endpoints:");
        logger.info("  GET  /health            - Health check");
        logger.info("  GET  /api/config        - Active scoring configuration");
        logger.info("  POST /api/ldsi          - Score text_b against text_a");
        logger.info("  POST /api/ncd           - Compression distance");
        logger.info("  POST /api/entropy       - Entropy comparison");
        logger.info("  POST /api/topology      - Co-occurrence graph metrics");
        logger.info("  POST /api/topology/svg  - Co-occurrence graph SVG");
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            logger.info("API server stopped");
        }
    }

    /**
     * Bound port; differs from the constructor argument when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Wrap a handler to map exceptions to JSON errors: malformed requests
     * give 400, anything else 500.
     */
    private com.sun.net.httpserver.HttpHandler wrapHandler(
            com.sun.net.httpserver.HttpHandler handler) {
        return exchange -> {
            String method = exchange.getRequestMethod();
            if ("OPTIONS".equalsIgnoreCase(method)) {
                addCorsHeaders(exchange);
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
                return;
            }
            try {
                addCorsHeaders(exchange);
                handler.handle(exchange);
            } catch (InvalidInputException | JSONException e) {
                logger.debug("Rejected {} {}: {}", method, exchange.getRequestURI(), e.getMessage());
                sendErrorSafely(exchange, 400, e.getMessage());
            } catch (Throwable t) {
                if (isClientConnectionIssue(t)) {
                    logger.debug("Client disconnected: {}", t.getMessage());
                    closeQuietly(exchange);
                    return;
                }
                logger.error("Unhandled exception on {} {}", method, exchange.getRequestURI(), t);
                sendErrorSafely(exchange, 500, t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
            }
        };
    }

    private void sendErrorSafely(com.sun.net.httpserver.HttpExchange exchange, int status, String message) {
        try {
            if (exchange.getResponseCode() != -1) {
                logger.warn("Cannot send error response: headers already sent");
                return;
            }
            sendError(exchange, status, message);
        } catch (IOException e) {
            logger.debug("Failed to send error response: {}", e.getMessage());
        } finally {
            closeQuietly(exchange);
        }
    }

    private boolean isClientConnectionIssue(Throwable t) {
        Throwable current = t;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("broken pipe")
                    || lower.contains("connection reset")
                    || lower.contains("forcibly closed")
                    || lower.contains("insufficient bytes written to stream")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private void closeQuietly(com.sun.net.httpserver.HttpExchange exchange) {
        try {
            exchange.close();
        } catch (RuntimeException e) {
            logger.trace("Close failed: {}", e.getMessage());
        }
    }

    private void addCorsHeaders(com.sun.net.httpserver.HttpExchange exchange) {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type, Authorization");
    }

    private void handleHealth(com.sun.net.httpserver.HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", "ldsi");
        response.put("version", LdsiScorer.VERSION);
        response.put("port", getPort());
        sendJson(exchange, 200, response);
    }

    private void handleConfig(com.sun.net.httpserver.HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("config", config.toJson());
        sendJson(exchange, 200, response);
    }

    private void handleLdsi(com.sun.net.httpserver.HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        JSONObject body = readBody(exchange);
        String textA = requireText(body, "text_a");
        String textB = requireText(body, "text_b");

        LdsiConfig requestConfig = config;
        JSONObject coefficients = body.getJSONObject("coefficients");
        if (coefficients != null) {
            requestConfig = requestConfig.withCoefficients(
                LdsiCoefficients.fromJson(coefficients, requestConfig.coefficients()));
        }
        String scoring = body.getString("structural_scoring");
        if (scoring != null) {
            requestConfig = requestConfig.withStructuralScoring(StructuralScoring.parse(scoring));
        }
        if (body.getBooleanValue("clean")) {
            TextCleaner cleaner = new TextCleaner(
                CleanerConfig.fromJson(body.getJSONObject("cleaner"), CleanerConfig.DEFAULT));
            textA = cleaner.clean(textA);
            textB = cleaner.clean(textB);
        }

        long start = System.nanoTime();
        LdsiResult result = LdsiScorer.score(textA, textB, requestConfig);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("result", result.toJson());
        response.put("duration_ms", elapsedMs);
        sendJson(exchange, 200, response);
    }

    private void handleNcd(com.sun.net.httpserver.HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        JSONObject body = readBody(exchange);
        CompressionMeasurement ncd = NcdCalculator.compute(requireText(body, "text_a"), requireText(body, "text_b"));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("ncd", ncd.toJson());
        sendJson(exchange, 200, response);
    }

    private void handleEntropy(com.sun.net.httpserver.HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        JSONObject body = readBody(exchange);
        EntropyMeasurement a = EntropyAnalyzer.analyze(requireText(body, "text_a"));
        EntropyMeasurement b = EntropyAnalyzer.analyze(requireText(body, "text_b"));
        EntropyComparison comparison = EntropyAnalyzer.compare(a, b);

        JSONObject entropy = comparison.toJson();
        entropy.put("tokens_a", a.totalTokens());
        entropy.put("tokens_b", b.totalTokens());
        entropy.put("unique_a", a.uniqueTokens());
        entropy.put("unique_b", b.uniqueTokens());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("entropy", entropy);
        sendJson(exchange, 200, response);
    }

    private void handleTopology(com.sun.net.httpserver.HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        // "/api/topology/svg" is its own context; anything else below this path is unknown
        if (!"/api/topology".equals(exchange.getRequestURI().getPath())) {
            sendError(exchange, 404, "Not found: " + exchange.getRequestURI().getPath());
            return;
        }
        JSONObject body = readBody(exchange);
        List<String> tokens = WordTokenizer.tokenize(requireText(body, "text"));
        CooccurrenceGraph graph = CooccurrenceGraphBuilder.build(tokens);
        TopologyMetrics metrics = TopologyAnalyzer.analyze(graph);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("metrics", metrics.toJson());
        response.put("graph", graph.toJson());
        sendJson(exchange, 200, response);
    }

    private void handleTopologySvg(com.sun.net.httpserver.HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        JSONObject body = readBody(exchange);
        int width = sizeParam(body, "width", DEFAULT_SVG_WIDTH);
        int height = sizeParam(body, "height", DEFAULT_SVG_HEIGHT);
        CooccurrenceGraph graph = CooccurrenceGraphBuilder.build(WordTokenizer.tokenize(requireText(body, "text")));

        String svg = GraphSvgRenderer.render(graph, width, height);
        byte[] bytes = svg.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "image/svg+xml; charset=utf-8");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static int sizeParam(JSONObject body, String name, int fallback) {
        Integer value = body.getInteger(name);
        if (value == null) {
            return fallback;
        }
        if (value <= 100 || value > MAX_SVG_SIZE) {
            throw InvalidInputException.invalidParameter(name, value, "in (100, " + MAX_SVG_SIZE + "]");
        }
        return value;
    }

    private static JSONObject readBody(com.sun.net.httpserver.HttpExchange exchange) throws IOException {
        String raw = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        if (raw.isBlank()) {
            throw new InvalidInputException("Request body must be a JSON object");
        }
        JSONObject body = JSON.parseObject(raw);
        if (body == null) {
            throw new InvalidInputException("Request body must be a JSON object");
        }
        return body;
    }

    private static String requireText(JSONObject body, String field) {
        String value = body.getString(field);
        if (value == null) {
            throw new InvalidInputException("Missing required field: " + field);
        }
        return value;
    }

    private void sendJson(com.sun.net.httpserver.HttpExchange exchange, int status, Map<String, Object> data)
            throws IOException {
        String json = JSON.toJSONString(data, com.alibaba.fastjson2.JSONWriter.Feature.WriteMapNullValue);
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-store, no-cache, must-revalidate, max-age=0");
        exchange.sendResponseHeaders(status, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private void sendError(com.sun.net.httpserver.HttpExchange exchange, int status, String message)
            throws IOException {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", "error");
        error.put("message", message);
        error.put("code", status);
        sendJson(exchange, status, error);
    }
}
