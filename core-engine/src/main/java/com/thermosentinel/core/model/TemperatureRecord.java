package com.thermosentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One daily temperature observation for a city.
 *
 * <p>
 * Records are immutable. Smoothing does not modify a record in place, it
 * produces a copy via {@link #withSmoothedTemperature(double)}. A record whose
 * smoothed temperature is absent either has not been smoothed yet or sits at a
 * position with fewer than <i>W</i> earlier observations of the same city
 * (insufficient history).
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code city}, {@code timestamp} and {@code season}
 * are required; omitting any of them throws a {@link NullPointerException} at
 * build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"city", "timestamp", "season", "temperature", "smoothedTemperature"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TemperatureRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String city;
    private final Instant timestamp;
    private final String season;
    private final double rawTemperature;

    /** {@code null} marks insufficient history. */
    private final Double smoothedTemperature;

    private TemperatureRecord(Builder builder) {
        this.city = Objects.requireNonNull(builder.city, "city must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.season = Objects.requireNonNull(builder.season, "season must not be null");
        this.rawTemperature = builder.rawTemperature;
        this.smoothedTemperature = builder.smoothedTemperature;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link TemperatureRecord} instances.
     */
    public static class Builder {
        private String city;
        private Instant timestamp;
        private String season;
        private double rawTemperature;
        private Double smoothedTemperature;

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder season(String season) {
            this.season = season;
            return this;
        }

        public Builder rawTemperature(double rawTemperature) {
            this.rawTemperature = rawTemperature;
            return this;
        }

        public Builder smoothedTemperature(Double smoothedTemperature) {
            this.smoothedTemperature = smoothedTemperature;
            return this;
        }

        /**
         * Build the record.
         *
         * @return a new {@link TemperatureRecord}
         * @throws NullPointerException if {@code city}, {@code timestamp} or
         *                              {@code season} is {@code null}
         */
        public TemperatureRecord build() {
            return new TemperatureRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Smoothing
    // ---------------------------------------------------------------

    /**
     * Return a copy of this record carrying the given smoothed temperature.
     *
     * @param smoothed the trailing moving average at this record's position
     * @return a new record; this instance is unchanged
     */
    public TemperatureRecord withSmoothedTemperature(double smoothed) {
        return toBuilder().smoothedTemperature(smoothed).build();
    }

    /**
     * Return a copy of this record with the smoothed temperature cleared,
     * i.e. marked as having insufficient history.
     *
     * @return a new record; this instance is unchanged
     */
    public TemperatureRecord withoutSmoothedTemperature() {
        return toBuilder().smoothedTemperature(null).build();
    }

    private Builder toBuilder() {
        return builder()
                .city(city)
                .timestamp(timestamp)
                .season(season)
                .rawTemperature(rawTemperature);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getCity() {
        return city;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSeason() {
        return season;
    }

    @JsonProperty("temperature")
    public double getRawTemperature() {
        return rawTemperature;
    }

    /**
     * @return the smoothed temperature, or empty when history is insufficient
     */
    @JsonIgnore
    public OptionalDouble getSmoothedTemperature() {
        return smoothedTemperature != null
                ? OptionalDouble.of(smoothedTemperature)
                : OptionalDouble.empty();
    }

    /**
     * @return {@code true} if a smoothed temperature is present
     */
    public boolean hasSmoothedTemperature() {
        return smoothedTemperature != null;
    }

    @JsonProperty("smoothedTemperature")
    Double smoothedTemperatureOrNull() {
        return smoothedTemperature;
    }

    /**
     * @return the (city, season) group this record belongs to
     */
    @JsonIgnore
    public SeasonKey getSeasonKey() {
        return SeasonKey.of(city, season);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TemperatureRecord that))
            return false;
        return Double.compare(rawTemperature, that.rawTemperature) == 0
                && city.equals(that.city)
                && timestamp.equals(that.timestamp)
                && season.equals(that.season)
                && Objects.equals(smoothedTemperature, that.smoothedTemperature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(city, timestamp, season, rawTemperature, smoothedTemperature);
    }

    @Override
    public String toString() {
        return "TemperatureRecord{" +
                "city='" + city + '\'' +
                ", timestamp=" + timestamp +
                ", season='" + season + '\'' +
                ", rawTemperature=" + rawTemperature +
                ", smoothedTemperature=" + smoothedTemperature +
                '}';
    }
}
