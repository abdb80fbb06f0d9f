package com.thermosentinel.core.stats;

import com.thermosentinel.core.model.SeasonKey;
import com.thermosentinel.core.model.SeasonalStat;
import com.thermosentinel.core.model.TemperatureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes the baseline (mean, sample standard deviation) of the smoothed
 * temperature for every (city, season) group.
 *
 * <p>
 * Only records that carry a smoothed temperature take part; records with
 * insufficient history are skipped, never counted as zero. A group therefore
 * exists only if at least one of its records was smoothed.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Group values are sorted before they are summed, so the result is
 * bit-for-bit identical for any permutation of the same input.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalStatsCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalStatsCalculator.class);

    /**
     * @param records smoothed records of any number of cities; must not be
     *                {@code null}
     * @return unmodifiable map from group to its statistics, ordered by city
     *         then season
     */
    public SortedMap<SeasonKey, SeasonalStat> calculate(List<TemperatureRecord> records) {
        Objects.requireNonNull(records, "records must not be null");

        SortedMap<SeasonKey, List<Double>> groups = new TreeMap<>();
        for (TemperatureRecord record : records) {
            record.getSmoothedTemperature().ifPresent(value -> groups
                    .computeIfAbsent(record.getSeasonKey(), k -> new ArrayList<>())
                    .add(value));
        }

        SortedMap<SeasonKey, SeasonalStat> stats = new TreeMap<>();
        for (Map.Entry<SeasonKey, List<Double>> group : groups.entrySet()) {
            SeasonalStat stat = summarize(group.getKey(), group.getValue());
            if (!stat.hasBaseline()) {
                LOG.debug("Group {} has a single sample; stddev undefined", group.getKey());
            }
            stats.put(group.getKey(), stat);
        }

        LOG.info("Computed seasonal statistics for {} group(s)", stats.size());
        return Collections.unmodifiableSortedMap(stats);
    }

    // ---------------------------------------------------------------
    // Statistics helpers
    // ---------------------------------------------------------------

    static SeasonalStat summarize(SeasonKey key, List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);

        int n = sorted.size();
        double mean = computeMean(sorted);
        Double stddev = n >= 2 ? computeSampleStdDev(sorted, mean) : null;
        return new SeasonalStat(key, n, mean, stddev);
    }

    static double computeMean(List<Double> values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /** Divisor {@code n - 1}; caller guarantees {@code n >= 2}. */
    static double computeSampleStdDev(List<Double> values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.size() - 1));
    }
}
