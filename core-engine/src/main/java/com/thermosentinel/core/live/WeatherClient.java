package com.thermosentinel.core.live;

import java.util.concurrent.CompletableFuture;

/**
 * Source of live temperature readings.
 *
 * <p>
 * Implementations must complete the returned future <strong>normally</strong>
 * in every case: transport problems, non-success responses and unparseable
 * bodies are reported as {@link LiveFetchResult#failure failures}, not as
 * exceptional completion. Callers may cancel the future to abandon a fetch.
 * </p>
 *
 * @since 1.0.0
 */
public interface WeatherClient {

    /**
     * Start fetching the current temperature of a city.
     *
     * @param city   city name as known to the provider
     * @param apiKey provider credentials
     * @return future completing with the reading or a structured error
     */
    CompletableFuture<LiveFetchResult> fetch(String city, String apiKey);
}
