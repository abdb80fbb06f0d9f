package com.thermosentinel.core.pipeline;

import com.thermosentinel.core.config.AnalysisConfig;
import com.thermosentinel.core.detection.AnomalyDetector;
import com.thermosentinel.core.live.LiveClassifier;
import com.thermosentinel.core.model.SeasonKey;
import com.thermosentinel.core.model.SeasonalStat;
import com.thermosentinel.core.model.TemperatureRecord;
import com.thermosentinel.core.smoothing.Smoother;
import com.thermosentinel.core.stats.SeasonalStatsCalculator;
import com.thermosentinel.core.store.TemperatureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Batch analysis pipeline.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   TemperatureStore
 *     → Smoother (per city, trailing window)
 *     → SeasonalStatsCalculator (per city and season)
 *     → AnomalyDetector (mean ± k × σ, using the stats above)
 *     → AnalysisResult
 * </pre>
 *
 * <p>
 * Each call to {@link #analyze(TemperatureStore)} is a pure transform of the
 * store: no state is carried from one run to the next, so analysing the same
 * store twice yields equal results.
 * </p>
 *
 * @since 1.0.0
 */
public class TemperatureAnalysis {

    private static final Logger LOG = LoggerFactory.getLogger(TemperatureAnalysis.class);

    private final Smoother smoother;
    private final SeasonalStatsCalculator statsCalculator;
    private final AnomalyDetector anomalyDetector;
    private final LiveClassifier liveClassifier;

    /**
     * @param config validated pipeline parameters; must not be {@code null}
     */
    public TemperatureAnalysis(AnalysisConfig config) {
        Objects.requireNonNull(config, "AnalysisConfig must not be null");
        this.smoother = new Smoother(config.getWindowSize());
        this.statsCalculator = new SeasonalStatsCalculator();
        this.anomalyDetector = new AnomalyDetector(config.getDeviationFactor(), statsCalculator);
        this.liveClassifier = new LiveClassifier(config.getDeviationFactor());
    }

    /**
     * Run the full pipeline once.
     *
     * @param store the ingested records; must not be {@code null}
     * @return smoothed records, baselines and anomalies
     */
    public AnalysisResult analyze(TemperatureStore store) {
        Objects.requireNonNull(store, "TemperatureStore must not be null");
        LOG.info("Analysing {} record(s) across {} city(ies)", store.size(), store.cities().size());

        List<TemperatureRecord> smoothed = smoother.smooth(store.records());
        SortedMap<SeasonKey, SeasonalStat> stats = statsCalculator.calculate(smoothed);
        List<TemperatureRecord> anomalies = anomalyDetector.detect(smoothed, stats);

        AnalysisResult result = new AnalysisResult(smoothed, stats, anomalies, liveClassifier);
        LOG.info("Analysis complete: {}", result);
        return result;
    }
}
