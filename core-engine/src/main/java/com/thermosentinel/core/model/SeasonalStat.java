package com.thermosentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Baseline statistics of the smoothed temperature for one (city, season)
 * group.
 *
 * <p>
 * The standard deviation is the <strong>sample</strong> standard deviation
 * (divisor {@code n - 1}). For a group with a single observation it is
 * undefined rather than zero, and {@link #hasBaseline()} returns
 * {@code false}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"city", "season", "sampleCount", "mean", "stddev"})
public final class SeasonalStat implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SeasonKey key;
    private final int sampleCount;
    private final double mean;

    /** {@code null} when {@code sampleCount < 2}. */
    private final Double stddev;

    /**
     * @param key         the group
     * @param sampleCount number of smoothed values in the group; at least 1
     * @param mean        arithmetic mean of those values
     * @param stddev      sample standard deviation, or {@code null} if
     *                    undefined
     * @throws NullPointerException     if {@code key} is {@code null}
     * @throws IllegalArgumentException if {@code sampleCount < 1}, or if a
     *                                  stddev is given for fewer than two
     *                                  samples
     */
    public SeasonalStat(SeasonKey key, int sampleCount, double mean, Double stddev) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        if (sampleCount < 1) {
            throw new IllegalArgumentException(
                    "sampleCount must be >= 1 for group " + key + ", got: " + sampleCount);
        }
        if (stddev != null && sampleCount < 2) {
            throw new IllegalArgumentException(
                    "stddev is undefined for a single-sample group " + key);
        }
        this.sampleCount = sampleCount;
        this.mean = mean;
        this.stddev = stddev;
    }

    @JsonIgnore
    public SeasonKey getKey() {
        return key;
    }

    public String getCity() {
        return key.getCity();
    }

    public String getSeason() {
        return key.getSeason();
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public double getMean() {
        return mean;
    }

    /**
     * @return the sample standard deviation, or empty if the group has fewer
     *         than two samples
     */
    @JsonIgnore
    public OptionalDouble getStddev() {
        return stddev != null ? OptionalDouble.of(stddev) : OptionalDouble.empty();
    }

    @JsonProperty("stddev")
    Double stddevOrNull() {
        return stddev;
    }

    /**
     * @return {@code true} if both mean and stddev are defined, i.e. the group
     *         can serve as a reference for anomaly thresholds
     */
    public boolean hasBaseline() {
        return stddev != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeasonalStat that))
            return false;
        return sampleCount == that.sampleCount
                && Double.compare(mean, that.mean) == 0
                && key.equals(that.key)
                && Objects.equals(stddev, that.stddev);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, sampleCount, mean, stddev);
    }

    @Override
    public String toString() {
        return "SeasonalStat{" +
                "key=" + key +
                ", sampleCount=" + sampleCount +
                ", mean=" + mean +
                ", stddev=" + stddev +
                '}';
    }
}
