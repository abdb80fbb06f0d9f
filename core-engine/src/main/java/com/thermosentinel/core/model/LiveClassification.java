package com.thermosentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

/**
 * A live temperature reading together with its classification against the
 * city's current-season baseline.
 *
 * <p>
 * {@code reason} is set if and only if the status is
 * {@link Classification#INDETERMINATE}. {@code season} is {@code null} when the
 * city has no historical records at all.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"city", "season", "temperature", "status", "reason"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class LiveClassification implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String city;
    private final String season;
    private final double temperature;
    private final Classification status;
    private final IndeterminateReason reason;

    private LiveClassification(String city, String season, double temperature,
            Classification status, IndeterminateReason reason) {
        this.city = Objects.requireNonNull(city, "city must not be null");
        this.season = season;
        this.temperature = temperature;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.reason = reason;
    }

    /**
     * @param city        the city
     * @param season      the current season used as reference
     * @param temperature the live reading
     * @param normal      whether the reading lies within the baseline band
     * @return a {@code normal} or {@code anomalous} classification
     */
    public static LiveClassification determined(String city, String season,
            double temperature, boolean normal) {
        Objects.requireNonNull(season, "season must not be null");
        return new LiveClassification(city, season, temperature,
                normal ? Classification.NORMAL : Classification.ANOMALOUS, null);
    }

    /**
     * @param city        the city
     * @param season      the current season, or {@code null} if unknown
     * @param temperature the live reading
     * @param reason      why no classification was possible
     * @return an {@code indeterminate} classification
     */
    public static LiveClassification indeterminate(String city, String season,
            double temperature, IndeterminateReason reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        return new LiveClassification(city, season, temperature,
                Classification.INDETERMINATE, reason);
    }

    public String getCity() {
        return city;
    }

    public String getSeason() {
        return season;
    }

    public double getTemperature() {
        return temperature;
    }

    public Classification getStatus() {
        return status;
    }

    public IndeterminateReason getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LiveClassification that))
            return false;
        return Double.compare(temperature, that.temperature) == 0
                && city.equals(that.city)
                && Objects.equals(season, that.season)
                && status == that.status
                && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(city, season, temperature, status, reason);
    }

    @Override
    public String toString() {
        return "LiveClassification{" +
                "city='" + city + '\'' +
                ", season='" + season + '\'' +
                ", temperature=" + temperature +
                ", status=" + status +
                (reason != null ? ", reason=" + reason : "") +
                '}';
    }
}
