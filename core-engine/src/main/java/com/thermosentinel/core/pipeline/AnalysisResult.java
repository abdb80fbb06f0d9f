package com.thermosentinel.core.pipeline;

import com.thermosentinel.core.live.LiveClassifier;
import com.thermosentinel.core.model.LiveClassification;
import com.thermosentinel.core.model.SeasonKey;
import com.thermosentinel.core.model.SeasonalStat;
import com.thermosentinel.core.model.TemperatureRecord;
import com.thermosentinel.core.stats.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Output of one analysis run: the smoothed records, their seasonal
 * baselines, the anomaly subset and column summaries.
 *
 * <p>
 * Immutable. {@link #forCity(String)} returns a narrowed view that shares
 * nothing mutable with this instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisResult {

    private final List<TemperatureRecord> records;
    private final SortedMap<SeasonKey, SeasonalStat> seasonalStats;
    private final List<TemperatureRecord> anomalies;
    private final LiveClassifier liveClassifier;

    AnalysisResult(List<TemperatureRecord> records,
            Map<SeasonKey, SeasonalStat> seasonalStats,
            List<TemperatureRecord> anomalies,
            LiveClassifier liveClassifier) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.seasonalStats = Collections.unmodifiableSortedMap(new TreeMap<>(seasonalStats));
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(anomalies));
        this.liveClassifier = Objects.requireNonNull(liveClassifier, "liveClassifier must not be null");
    }

    /**
     * @return smoothed records, grouped by city and ordered by timestamp
     */
    public List<TemperatureRecord> getRecords() {
        return records;
    }

    /**
     * @return baseline per (city, season), ordered by city then season
     */
    public SortedMap<SeasonKey, SeasonalStat> getSeasonalStats() {
        return seasonalStats;
    }

    /**
     * @return flagged records, in the order of {@link #getRecords()}
     */
    public List<TemperatureRecord> getAnomalies() {
        return anomalies;
    }

    /**
     * @return summary of the raw temperature column
     */
    public DescriptiveStatistics rawSummary() {
        List<Double> values = new ArrayList<>(records.size());
        for (TemperatureRecord record : records) {
            values.add(record.getRawTemperature());
        }
        return DescriptiveStatistics.of(values);
    }

    /**
     * @return summary of the smoothed temperature column; records with
     *         insufficient history are skipped
     */
    public DescriptiveStatistics smoothedSummary() {
        List<Double> values = new ArrayList<>(records.size());
        for (TemperatureRecord record : records) {
            record.getSmoothedTemperature().ifPresent(values::add);
        }
        return DescriptiveStatistics.of(values);
    }

    /**
     * Narrow every table to one city.
     *
     * @param city the city to keep
     * @return a result holding only that city's records, stats and anomalies
     */
    public AnalysisResult forCity(String city) {
        Objects.requireNonNull(city, "city must not be null");

        SortedMap<SeasonKey, SeasonalStat> cityStats = new TreeMap<>();
        seasonalStats.forEach((key, stat) -> {
            if (key.getCity().equals(city)) {
                cityStats.put(key, stat);
            }
        });

        return new AnalysisResult(
                records.stream().filter(r -> r.getCity().equals(city)).toList(),
                cityStats,
                anomalies.stream().filter(r -> r.getCity().equals(city)).toList(),
                liveClassifier);
    }

    /**
     * Classify a live reading against the baselines of this result.
     *
     * @param city      the city the reading belongs to
     * @param liveValue the live temperature
     * @return the classification
     */
    public LiveClassification classifyLive(String city, double liveValue) {
        return liveClassifier.classify(city, liveValue, records, seasonalStats);
    }

    @Override
    public String toString() {
        return "AnalysisResult{" +
                "records=" + records.size() +
                ", groups=" + seasonalStats.size() +
                ", anomalies=" + anomalies.size() +
                '}';
    }
}
