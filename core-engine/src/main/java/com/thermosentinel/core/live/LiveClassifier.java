package com.thermosentinel.core.live;

import com.thermosentinel.core.model.IndeterminateReason;
import com.thermosentinel.core.model.LiveClassification;
import com.thermosentinel.core.model.SeasonKey;
import com.thermosentinel.core.model.SeasonalStat;
import com.thermosentinel.core.model.TemperatureRecord;
import com.thermosentinel.core.store.TemperatureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies a live reading against the baseline of the city's current
 * season.
 *
 * <p>
 * The current season is the season of the city's chronologically latest
 * historical record. The reading is {@code normal} when
 * {@code |value − mean| ≤ deviationFactor × σ} and {@code anomalous}
 * otherwise. Missing or single-sample baselines give {@code indeterminate};
 * the classifier never falls back to {@code normal}.
 * </p>
 *
 * @since 1.0.0
 */
public class LiveClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(LiveClassifier.class);

    private final double deviationFactor;

    /**
     * @param deviationFactor number of standard deviations for the band
     * @throws IllegalArgumentException if {@code deviationFactor} is not a
     *                                  finite number &gt; 0
     */
    public LiveClassifier(double deviationFactor) {
        if (!(deviationFactor > 0) || Double.isInfinite(deviationFactor)) {
            throw new IllegalArgumentException(
                    "deviationFactor must be a finite number > 0, got: " + deviationFactor);
        }
        this.deviationFactor = deviationFactor;
    }

    /**
     * @param city    the city name
     * @param records historical records
     * @return season of the city's latest record, or empty if the city has none
     */
    public Optional<String> currentSeason(String city, List<TemperatureRecord> records) {
        return TemperatureStore.latest(records, city).map(TemperatureRecord::getSeason);
    }

    /**
     * Classify a live reading for a city.
     *
     * @param city        the city name
     * @param liveValue   the live temperature
     * @param records     historical records used to find the current season
     * @param baselines   seasonal statistics of those records
     * @return the classification; {@code indeterminate} if no usable baseline
     *         exists
     */
    public LiveClassification classify(String city, double liveValue,
            List<TemperatureRecord> records, Map<SeasonKey, SeasonalStat> baselines) {
        Objects.requireNonNull(city, "city must not be null");
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(baselines, "baselines must not be null");

        Optional<String> season = currentSeason(city, records);
        if (season.isEmpty()) {
            LOG.warn("No historical records for city '{}'; live reading is indeterminate", city);
            return LiveClassification.indeterminate(city, null, liveValue,
                    IndeterminateReason.NO_BASELINE_FOR_SEASON);
        }

        SeasonalStat baseline = baselines.get(SeasonKey.of(city, season.get()));
        if (baseline == null) {
            LOG.warn("No baseline for {}; live reading is indeterminate",
                    SeasonKey.of(city, season.get()));
            return LiveClassification.indeterminate(city, season.get(), liveValue,
                    IndeterminateReason.NO_BASELINE_FOR_SEASON);
        }
        return classify(city, liveValue, baseline);
    }

    /**
     * Classify a live reading against a known baseline.
     *
     * @param city      the city name
     * @param liveValue the live temperature
     * @param baseline  statistics of the current (city, season) group
     * @return the classification
     */
    public LiveClassification classify(String city, double liveValue, SeasonalStat baseline) {
        Objects.requireNonNull(baseline, "baseline must not be null");

        if (!baseline.hasBaseline()) {
            LOG.warn("Baseline {} has {} sample(s); live reading is indeterminate",
                    baseline.getKey(), baseline.getSampleCount());
            return LiveClassification.indeterminate(city, baseline.getSeason(), liveValue,
                    IndeterminateReason.UNDEFINED_BASELINE);
        }

        double stddev = baseline.getStddev().getAsDouble();
        boolean normal = Math.abs(liveValue - baseline.getMean()) <= deviationFactor * stddev;
        LOG.info("Live reading {} for {} is {} (mean={}, stddev={})", liveValue, baseline.getKey(),
                normal ? "normal" : "anomalous", baseline.getMean(), stddev);
        return LiveClassification.determined(city, baseline.getSeason(), liveValue, normal);
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }
}
