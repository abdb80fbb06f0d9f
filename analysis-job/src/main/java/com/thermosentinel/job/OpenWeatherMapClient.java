package com.thermosentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.thermosentinel.core.live.LiveFetchError;
import com.thermosentinel.core.live.LiveFetchResult;
import com.thermosentinel.core.live.WeatherClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link WeatherClient} backed by the OpenWeatherMap current-weather API.
 *
 * <h3>Exchange</h3>
 *
 * <pre>
 *   GET {baseUrl}?q={city}&amp;appid={apiKey}&amp;units=metric
 *     200   → {"main": {"temp": 4.2}, ...}
 *     other → {"cod": "404", "message": "city not found"}
 * </pre>
 *
 * <p>
 * Every outcome, including connection failures and timeouts, completes the
 * returned future normally with a {@link LiveFetchResult}. Cancelling the
 * returned future aborts the HTTP exchange. The API key is never logged.
 * </p>
 *
 * @since 1.0.0
 */
public class OpenWeatherMapClient implements WeatherClient {

    private static final Logger LOG = LoggerFactory.getLogger(OpenWeatherMapClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final Duration timeout;

    /**
     * @param baseUrl endpoint of the current-weather API
     * @param timeout bound for connecting and for the whole request
     */
    public OpenWeatherMapClient(String baseUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), baseUrl, timeout);
    }

    OpenWeatherMapClient(HttpClient httpClient, ObjectMapper mapper, String baseUrl, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public CompletableFuture<LiveFetchResult> fetch(String city, String apiKey) {
        Objects.requireNonNull(city, "city must not be null");
        Objects.requireNonNull(apiKey, "apiKey must not be null");

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(buildUri(city, apiKey))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            LOG.warn("Cannot build weather request for '{}': {}", city, e.getMessage());
            return CompletableFuture.completedFuture(LiveFetchResult.failure(city,
                    LiveFetchError.of("Invalid weather request: " + e.getMessage())));
        }

        LOG.info("Fetching live temperature for '{}'", city);
        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        return propagateCancellation(exchange.handle((response, failure) -> failure != null
                ? transportFailure(city, failure)
                : toResult(city, response.statusCode(), response.body())), exchange);
    }

    /**
     * Cancelling {@code result} also cancels {@code exchange}, which aborts the
     * HTTP request instead of leaving it to run until its own timeout.
     *
     * @return {@code result}
     */
    static <T> CompletableFuture<T> propagateCancellation(CompletableFuture<T> result,
            CompletableFuture<?> exchange) {
        result.whenComplete((value, failure) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    // ---------------------------------------------------------------
    // Response mapping
    // ---------------------------------------------------------------

    LiveFetchResult toResult(String city, int status, String body) {
        JsonNode root = parse(body);

        if (status == 200) {
            JsonNode temp = root != null ? root.path("main").path("temp") : null;
            if (temp == null || !temp.isNumber()) {
                LOG.warn("Weather response for '{}' has no numeric main.temp", city);
                return LiveFetchResult.failure(city,
                        LiveFetchError.of("Malformed weather response: missing main.temp", status));
            }
            LOG.info("Live temperature for '{}': {}", city, temp.asDouble());
            return LiveFetchResult.success(city, temp.asDouble());
        }

        JsonNode message = root != null ? root.path("message") : null;
        String text = message != null && message.isTextual() && !message.asText().isBlank()
                ? message.asText()
                : "HTTP " + status;
        LOG.warn("Weather provider rejected request for '{}': status={} message={}", city, status, text);
        return LiveFetchResult.failure(city, LiveFetchError.of(text, status));
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            LOG.debug("Weather response is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static LiveFetchResult transportFailure(String city, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        String message = cause instanceof HttpTimeoutException
                ? "Weather request timed out"
                : "Weather request failed: " + cause.getClass().getSimpleName()
                        + (cause.getMessage() != null ? " - " + cause.getMessage() : "");
        LOG.warn("Live fetch for '{}' failed: {}", city, message);
        return LiveFetchResult.failure(city, LiveFetchError.of(message));
    }

    private URI buildUri(String city, String apiKey) {
        String separator = baseUrl.contains("?") ? "&" : "?";
        return URI.create(baseUrl + separator
                + "q=" + URLEncoder.encode(city, StandardCharsets.UTF_8)
                + "&appid=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)
                + "&units=metric");
    }
}
