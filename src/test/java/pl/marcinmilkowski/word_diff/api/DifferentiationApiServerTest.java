package pl.marcinmilkowski.word_diff.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.*;
import pl.marcinmilkowski.word_diff.engine.DifferentiationContext;
import pl.marcinmilkowski.word_diff.engine.PairEvaluator;
import pl.marcinmilkowski.word_diff.graph.TestGraphs;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class DifferentiationApiServerTest {

    private static DifferentiationApiServer server;
    private static HttpClient client;

    @BeforeAll
    static void setUp() throws IOException {
        server = DifferentiationApiServer.builder()
            .withEvaluator(new PairEvaluator(DifferentiationContext.of(TestGraphs.moneyBusiness())))
            .withPort(0)
            .build();
        server.start();
        client = HttpClient.newHttpClient();
    }

    @AfterAll
    static void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private static HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
            .GET()
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JSONObject body = JSON.parseObject(response.body());
        assertEquals("ok", body.getString("status"));
        assertEquals(2, body.getIntValue("terms"));
    }

    @Test
    @DisplayName("/api/differentiate should return the golden money / business scores")
    void testDifferentiate() throws Exception {
        HttpResponse<String> response = get("/api/differentiate?a=Money&b=business");

        assertEquals(200, response.statusCode());
        JSONObject body = JSON.parseObject(response.body());
        assertEquals("money", body.getString("seed_a"));
        assertEquals(2, body.getJSONObject("gd").getIntValue("termination_level"));
        assertEquals(2L, body.getJSONObject("wd").getLongValue("score"));
        assertEquals(2L, body.getJSONObject("sd").getLongValue("score"));
    }

    @Test
    void testDifferentiateMissingSeed() throws Exception {
        HttpResponse<String> response = get("/api/differentiate?a=money");

        assertEquals(400, response.statusCode());
        JSONObject body = JSON.parseObject(response.body());
        assertEquals("error", body.getString("status"));
        assertEquals(400, body.getIntValue("code"));
        assertEquals("Parameters 'a' and 'b' are required", body.getString("message"));
        assertFalse(body.containsKey("error"));
    }

    @Test
    void testExpand() throws Exception {
        HttpResponse<String> response = get("/api/expand?term=money");

        assertEquals(200, response.statusCode());
        JSONObject body = JSON.parseObject(response.body());
        assertTrue(body.getBooleanValue("defined"));
        assertEquals("debt", body.getJSONArray("definition").getString(1));
    }

    @Test
    void testConfig() throws Exception {
        HttpResponse<String> response = get("/api/config");

        assertEquals(200, response.statusCode());
        assertEquals(10000, JSON.parseObject(response.body()).getJSONObject("config").getIntValue("max_level"));
    }
}
