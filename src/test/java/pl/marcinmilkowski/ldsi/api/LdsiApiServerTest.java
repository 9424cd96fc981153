package pl.marcinmilkowski.ldsi.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.*;
import pl.marcinmilkowski.ldsi.config.LdsiConfig;
import pl.marcinmilkowski.ldsi.scoring.LdsiScorer;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the HTTP endpoints on an ephemeral port.
 */
class LdsiApiServerTest {

    private static final String TEXT_A = "La temperature est de vingt-cinq degres aujourd'hui.";
    private static final String TEXT_B = "La temperature est de 25 degres ce jour.";

    private LdsiApiServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() throws IOException {
        server = new LdsiApiServer(LdsiConfig.DEFAULT, 0);
        server.start();
        client = HttpClient.newHttpClient();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
            .GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static String pair(String a, String b) {
        JSONObject obj = new JSONObject();
        obj.put("text_a", a);
        obj.put("text_b", b);
        return obj.toJSONString();
    }

    @Test
    @DisplayName("Health check should report the engine version")
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/health");
        assertEquals(200, response.statusCode());
        JSONObject body = JSON.parseObject(response.body());
        assertEquals("ok", body.getString("status"));
        assertEquals(LdsiScorer.VERSION, body.getString("version"));
        assertEquals(server.getPort(), body.getIntValue("port"));
    }

    @Test
    @DisplayName("Scoring endpoint should return the same lambda as the library")
    void testScore() throws Exception {
        HttpResponse<String> response = post("/api/ldsi", pair(TEXT_A, TEXT_B));
        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));

        JSONObject result = JSON.parseObject(response.body()).getJSONObject("result");
        assertEquals(LdsiScorer.score(TEXT_A, TEXT_B).lambda(), result.getDoubleValue("lambda"), 1e-12);
        assertNotNull(result.getString("verdict"));
    }

    @Test
    @DisplayName("Per-request coefficients and scoring should be honoured")
    void testScoreOverrides() throws Exception {
        JSONObject body = JSON.parseObject(pair(TEXT_A, TEXT_B));
        body.put("coefficients", JSONObject.of("alpha", 1.0, "beta", 0.0, "gamma", 0.0));
        body.put("structural_scoring", "REFERENCE_DELTA");

        HttpResponse<String> response = post("/api/ldsi", body.toJSONString());
        assertEquals(200, response.statusCode());
        JSONObject result = JSON.parseObject(response.body()).getJSONObject("result");
        assertEquals(result.getJSONObject("ncd").getDoubleValue("corrected"), result.getDoubleValue("lambda"), 1e-12);
        assertEquals("REFERENCE_DELTA", result.getJSONObject("topology").getString("scoring"));
    }

    @Test
    @DisplayName("Bad requests should give 400, wrong methods 405")
    void testErrors() throws Exception {
        HttpResponse<String> missing = post("/api/ldsi", "{\"text_a\": \"seul\"}");
        assertEquals(400, missing.statusCode());
        assertEquals("Missing required field: text_b", JSON.parseObject(missing.body()).getString("message"));

        assertEquals(400, post("/api/ldsi", "{\"text_a\": ").statusCode());
        assertEquals(400, post("/api/ldsi", "").statusCode());
        assertEquals(405, get("/api/ldsi").statusCode());
        assertEquals(404, post("/api/topology/other", "{\"text\": \"a b c\"}").statusCode());
    }

    @Test
    @DisplayName("Component endpoints should return their signals")
    void testComponents() throws Exception {
        HttpResponse<String> ncd = post("/api/ncd", pair(TEXT_A, TEXT_A));
        assertEquals(0.0, JSON.parseObject(ncd.body()).getJSONObject("ncd").getDoubleValue("corrected"));

        HttpResponse<String> entropy = post("/api/entropy", pair(TEXT_A, TEXT_B));
        assertEquals(9, JSON.parseObject(entropy.body()).getJSONObject("entropy").getIntValue("tokens_a"));

        HttpResponse<String> topology = post("/api/topology", "{\"text\": \"" + TEXT_A + "\"}");
        JSONObject json = JSON.parseObject(topology.body());
        assertEquals(9, json.getJSONObject("graph").getJSONArray("nodes").size());
        assertEquals(0.5, json.getJSONObject("metrics").getDoubleValue("density"), 1e-12);
    }

    @Test
    @DisplayName("SVG endpoint should return an image")
    void testSvg() throws Exception {
        HttpResponse<String> response = post("/api/topology/svg", "{\"text\": \"un deux trois quatre\", \"width\": 400}");
        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("image/svg+xml"));
        assertTrue(response.body().contains("width=\"400\" height=\"700\""));

        assertEquals(400, post("/api/topology/svg", "{\"text\": \"a b\", \"width\": 50}").statusCode());
    }

    @Test
    @DisplayName("Config endpoint should expose the active configuration")
    void testConfig() throws Exception {
        HttpResponse<String> response = get("/api/config");
        assertEquals(200, response.statusCode());
        JSONObject config = JSON.parseObject(response.body()).getJSONObject("config");
        assertEquals(0.5, config.getJSONObject("coefficients").getDoubleValue("alpha"));
        assertEquals(1.2, config.getJSONObject("thresholds").getDoubleValue("architect"));
        assertEquals("ABSOLUTE_QUALITY", config.getString("structural_scoring"));
    }
}
