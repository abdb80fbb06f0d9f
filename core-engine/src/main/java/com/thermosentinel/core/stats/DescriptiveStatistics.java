package com.thermosentinel.core.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Summary of a temperature column: count, mean, sample standard deviation,
 * minimum, quartiles and maximum.
 *
 * <p>
 * Quartiles use linear interpolation between the closest ranks. Any statistic
 * that is undefined for the sample size (all of them for an empty column, the
 * standard deviation for a single value) is {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"count", "mean", "std", "min", "p25", "p50", "p75", "max"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DescriptiveStatistics {

    private final int count;
    private final Double mean;
    private final Double std;
    private final Double min;
    private final Double p25;
    private final Double p50;
    private final Double p75;
    private final Double max;

    private DescriptiveStatistics(int count, Double mean, Double std, Double min,
            Double p25, Double p50, Double p75, Double max) {
        this.count = count;
        this.mean = mean;
        this.std = std;
        this.min = min;
        this.p25 = p25;
        this.p50 = p50;
        this.p75 = p75;
        this.max = max;
    }

    /**
     * @param values the column values; must not be {@code null} or contain
     *               {@code null}
     * @return the summary
     */
    public static DescriptiveStatistics of(Collection<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
        int n = sorted.length;
        if (n == 0) {
            return new DescriptiveStatistics(0, null, null, null, null, null, null, null);
        }

        double sum = 0;
        for (double v : sorted) {
            sum += v;
        }
        double mean = sum / n;

        Double std = null;
        if (n >= 2) {
            double sumSquaredDiff = 0;
            for (double v : sorted) {
                sumSquaredDiff += (v - mean) * (v - mean);
            }
            std = Math.sqrt(sumSquaredDiff / (n - 1));
        }

        return new DescriptiveStatistics(n, mean, std, sorted[0],
                percentile(sorted, 0.25), percentile(sorted, 0.50), percentile(sorted, 0.75),
                sorted[n - 1]);
    }

    static double percentile(double[] sorted, double q) {
        double rank = q * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public int getCount() {
        return count;
    }

    public Double getMean() {
        return mean;
    }

    public Double getStd() {
        return std;
    }

    public Double getMin() {
        return min;
    }

    public Double getP25() {
        return p25;
    }

    public Double getP50() {
        return p50;
    }

    public Double getP75() {
        return p75;
    }

    public Double getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DescriptiveStatistics that))
            return false;
        return count == that.count
                && Objects.equals(mean, that.mean)
                && Objects.equals(std, that.std)
                && Objects.equals(min, that.min)
                && Objects.equals(p25, that.p25)
                && Objects.equals(p50, that.p50)
                && Objects.equals(p75, that.p75)
                && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, mean, std, min, p25, p50, p75, max);
    }

    @Override
    public String toString() {
        return "DescriptiveStatistics" + Arrays.asList(count, mean, std, min, p25, p50, p75, max);
    }
}
