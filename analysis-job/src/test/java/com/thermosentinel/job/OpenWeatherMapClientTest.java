package com.thermosentinel.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.thermosentinel.core.live.LiveFetchError;
import com.thermosentinel.core.live.LiveFetchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests {@link OpenWeatherMapClient} against a local stub of the weather API.
 */
class OpenWeatherMapClientTest {

    private HttpServer server;
    private ExecutorService executor;
    private volatile Map<String, String> lastQuery;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        executor = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/data/2.5/weather", this::handle);
        server.setExecutor(executor);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/data/2.5/weather";
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Status 200 should yield main.temp")
    void shouldReturnTemperature() throws Exception {
        LiveFetchResult result = client(Duration.ofSeconds(5)).fetch("London", "key-1")
                .get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTemperature()).hasValue(4.2);
        assertThat(result.getError()).isEmpty();
    }

    @Test
    @DisplayName("Should send city, key and metric units as query parameters")
    void shouldEncodeQuery() throws Exception {
        client(Duration.ofSeconds(5)).fetch("São Paulo", "a&b").get(5, TimeUnit.SECONDS);

        assertThat(lastQuery)
                .containsEntry("q", "São Paulo")
                .containsEntry("appid", "a&b")
                .containsEntry("units", "metric");
    }

    @Test
    @DisplayName("Provider message should be surfaced verbatim")
    void shouldSurfaceProviderMessage() throws Exception {
        LiveFetchResult result = client(Duration.ofSeconds(5)).fetch("Atlantis", "key-1")
                .get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains(LiveFetchError.of("city not found", 404));
    }

    @Test
    @DisplayName("A non-JSON error body should fall back to the status code")
    void shouldFallBackToStatus() throws Exception {
        LiveFetchResult result = client(Duration.ofSeconds(5)).fetch("Broken", "key-1")
                .get(5, TimeUnit.SECONDS);

        assertThat(result.getError()).contains(LiveFetchError.of("HTTP 500", 500));
    }

    @Test
    @DisplayName("A 200 without main.temp should be a malformed response")
    void shouldRejectMalformedBody() throws Exception {
        LiveFetchResult result = client(Duration.ofSeconds(5)).fetch("Garbage", "key-1")
                .get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().orElseThrow().getMessage())
                .isEqualTo("Malformed weather response: missing main.temp");
    }

    @Test
    @DisplayName("A slow provider should complete the future with a timeout error")
    void shouldTimeOut() throws Exception {
        LiveFetchResult result = client(Duration.ofMillis(200)).fetch("Slow", "key-1")
                .get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().orElseThrow().getMessage()).isEqualTo("Weather request timed out");
    }

    @Test
    @DisplayName("A connection failure should complete the future with an error")
    void shouldReportTransportFailure() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        OpenWeatherMapClient client = new OpenWeatherMapClient(
                "http://127.0.0.1:" + port + "/data/2.5/weather", Duration.ofSeconds(2));

        LiveFetchResult result = client.fetch("London", "key-1").get(5, TimeUnit.SECONDS);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().orElseThrow().getMessage()).startsWith("Weather request");
    }

    @Test
    @DisplayName("Cancelling the result should cancel the HTTP exchange")
    void shouldPropagateCancellation() {
        CompletableFuture<String> exchange = new CompletableFuture<>();
        CompletableFuture<Integer> result = OpenWeatherMapClient.propagateCancellation(
                exchange.thenApply(String::length), exchange);

        result.cancel(true);

        assertThat(exchange).isCancelled();
    }

    @Test
    @DisplayName("A completed result should leave the exchange alone")
    void shouldNotCancelCompletedExchange() {
        CompletableFuture<String> exchange = new CompletableFuture<>();
        CompletableFuture<Integer> result = OpenWeatherMapClient.propagateCancellation(
                exchange.thenApply(String::length), exchange);

        exchange.complete("{}");

        assertThat(result).isCompletedWithValue(2);
        assertThat(exchange).isNotCancelled();
    }

    @Test
    @DisplayName("Response mapping should read a numeric main.temp only")
    void shouldMapResponses() {
        OpenWeatherMapClient client = client(Duration.ofSeconds(1));

        assertThat(client.toResult("X", 200, "{\"main\":{\"temp\":-1.5}}").getTemperature())
                .hasValue(-1.5);
        assertThat(client.toResult("X", 200, "{\"main\":{\"temp\":\"cold\"}}").isSuccess())
                .isFalse();
        assertThat(client.toResult("X", 401, "{\"cod\":401,\"message\":\"Invalid API key\"}").getError())
                .contains(LiveFetchError.of("Invalid API key", 401));
        assertThat(client.toResult("X", 503, "").getError())
                .contains(LiveFetchError.of("HTTP 503", 503));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private OpenWeatherMapClient client(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        return new OpenWeatherMapClient(httpClient, new ObjectMapper(), baseUrl, timeout);
    }

    private void handle(HttpExchange exchange) throws IOException {
        Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
        lastQuery = query;

        String city = query.getOrDefault("q", "");
        switch (city) {
            case "Atlantis" -> respond(exchange, 404, "{\"cod\":\"404\",\"message\":\"city not found\"}");
            case "Broken" -> respond(exchange, 500, "<html>Internal Server Error</html>");
            case "Garbage" -> respond(exchange, 200, "{\"weather\":[]}");
            case "Slow" -> {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                respond(exchange, 200, "{\"main\":{\"temp\":1.0}}");
            }
            default -> respond(exchange, 200, "{\"name\":\"" + city + "\",\"main\":{\"temp\":4.2}}");
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return params;
    }
}
