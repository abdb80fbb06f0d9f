package com.thermosentinel.core.detection;

import com.thermosentinel.core.model.SeasonKey;
import com.thermosentinel.core.model.SeasonalStat;
import com.thermosentinel.core.model.TemperatureRecord;
import com.thermosentinel.core.stats.SeasonalStatsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Seasonal outlier detector.
 *
 * <p>
 * A record is an anomaly when its smoothed temperature lies outside
 * {@code mean ± deviationFactor × σ} of its own (city, season) group. The
 * group statistics come from {@link SeasonalStatsCalculator}; the detector
 * never derives its own, so the thresholds always match the published
 * baselines.
 * </p>
 *
 * <h3>Sparse groups</h3>
 * <p>
 * A group whose standard deviation is undefined (fewer than two samples)
 * flags nothing. Records without a smoothed temperature are never flagged.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This detector is <strong>stateless</strong>; it neither keeps history nor
 * modifies its input.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    private final double deviationFactor;
    private final SeasonalStatsCalculator statsCalculator;

    /**
     * @param deviationFactor number of standard deviations for the band
     * @throws IllegalArgumentException if {@code deviationFactor} is not a
     *                                  finite number &gt; 0
     */
    public AnomalyDetector(double deviationFactor) {
        this(deviationFactor, new SeasonalStatsCalculator());
    }

    /**
     * @param deviationFactor number of standard deviations for the band
     * @param statsCalculator source of group baselines for {@link #detect(List)}
     * @throws NullPointerException     if {@code statsCalculator} is {@code null}
     * @throws IllegalArgumentException if {@code deviationFactor} is not a
     *                                  finite number &gt; 0
     */
    public AnomalyDetector(double deviationFactor, SeasonalStatsCalculator statsCalculator) {
        if (!(deviationFactor > 0) || Double.isInfinite(deviationFactor)) {
            throw new IllegalArgumentException(
                    "deviationFactor must be a finite number > 0, got: " + deviationFactor);
        }
        this.deviationFactor = deviationFactor;
        this.statsCalculator = Objects.requireNonNull(statsCalculator,
                "statsCalculator must not be null");
    }

    /**
     * Compute the group baselines and flag outliers against them.
     *
     * @param records smoothed records; must not be {@code null}
     * @return flagged records in input order
     */
    public List<TemperatureRecord> detect(List<TemperatureRecord> records) {
        return detect(records, statsCalculator.calculate(records));
    }

    /**
     * Flag outliers against precomputed baselines.
     *
     * @param records   smoothed records; must not be {@code null}
     * @param baselines group statistics, normally from
     *                  {@link SeasonalStatsCalculator#calculate(List)} over the
     *                  same records; must not be {@code null}
     * @return unmodifiable list of flagged records in input order
     */
    public List<TemperatureRecord> detect(List<TemperatureRecord> records,
            Map<SeasonKey, SeasonalStat> baselines) {
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(baselines, "baselines must not be null");

        List<TemperatureRecord> anomalies = new ArrayList<>();
        for (TemperatureRecord record : records) {
            if (!record.hasSmoothedTemperature()) {
                continue;
            }
            SeasonalStat baseline = baselines.get(record.getSeasonKey());
            if (baseline != null && isAnomalous(record, baseline)) {
                LOG.debug("Anomaly: {} smoothed={} mean={} stddev={}",
                        record.getSeasonKey(), record.getSmoothedTemperature().getAsDouble(),
                        baseline.getMean(), baseline.getStddev().getAsDouble());
                anomalies.add(record);
            }
        }

        LOG.info("Flagged {} anomal{} out of {} record(s)", anomalies.size(),
                anomalies.size() == 1 ? "y" : "ies", records.size());
        return Collections.unmodifiableList(anomalies);
    }

    /**
     * Evaluate one record against a baseline.
     *
     * @param record   the record to test
     * @param baseline the statistics of the record's group
     * @return {@code true} if the smoothed temperature lies strictly outside
     *         the band; always {@code false} when the baseline has no stddev
     * @throws MissingSmoothedValueException if the record has no smoothed
     *                                       temperature
     */
    public boolean isAnomalous(TemperatureRecord record, SeasonalStat baseline) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(baseline, "baseline must not be null");

        double value = record.getSmoothedTemperature()
                .orElseThrow(() -> new MissingSmoothedValueException(record));

        if (!baseline.hasBaseline()) {
            return false;
        }
        double mean = baseline.getMean();
        double allowedDeviation = deviationFactor * baseline.getStddev().getAsDouble();
        return value < mean - allowedDeviation || value > mean + allowedDeviation;
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }
}
