package com.thermosentinel.core.live;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Outcome of a live-reading fetch: either a temperature in °C or a
 * {@link LiveFetchError}, never both.
 *
 * @since 1.0.0
 */
public final class LiveFetchResult {

    private final String city;
    private final Double temperature;
    private final LiveFetchError error;

    private LiveFetchResult(String city, Double temperature, LiveFetchError error) {
        this.city = Objects.requireNonNull(city, "city must not be null");
        this.temperature = temperature;
        this.error = error;
    }

    /**
     * @param city        the requested city
     * @param temperature the current temperature
     * @return a successful result
     */
    public static LiveFetchResult success(String city, double temperature) {
        return new LiveFetchResult(city, temperature, null);
    }

    /**
     * @param city  the requested city
     * @param error what went wrong
     * @return a failed result
     */
    public static LiveFetchResult failure(String city, LiveFetchError error) {
        return new LiveFetchResult(city, null,
                Objects.requireNonNull(error, "error must not be null"));
    }

    public String getCity() {
        return city;
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the temperature, or empty on failure
     */
    public OptionalDouble getTemperature() {
        return temperature != null ? OptionalDouble.of(temperature) : OptionalDouble.empty();
    }

    /**
     * @return the error, or empty on success
     */
    public Optional<LiveFetchError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "LiveFetchResult{city='" + city + "', temperature=" + temperature + '}'
                : "LiveFetchResult{city='" + city + "', error=" + error + '}';
    }
}
