package com.thermosentinel.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.thermosentinel.core.live.LiveFetchError;
import com.thermosentinel.core.model.LiveClassification;
import com.thermosentinel.core.model.SeasonalStat;
import com.thermosentinel.core.model.TemperatureRecord;
import com.thermosentinel.core.pipeline.AnalysisResult;
import com.thermosentinel.core.stats.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Presentation output for one city: the descriptive and seasonal tables, the
 * anomaly subset and, when a live reading was requested, either its
 * classification or the fetch error.
 *
 * <p>
 * {@code live} and {@code liveError} are mutually exclusive; both are absent
 * when no live reading was requested.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"city", "rawSummary", "smoothedSummary", "seasonalStats", "anomalies", "live",
        "liveError"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisReport {

    private final String city;
    private final DescriptiveStatistics rawSummary;
    private final DescriptiveStatistics smoothedSummary;
    private final List<SeasonalStat> seasonalStats;
    private final List<TemperatureRecord> anomalies;
    private final LiveClassification live;
    private final LiveFetchError liveError;

    private AnalysisReport(String city, AnalysisResult cityResult,
            LiveClassification live, LiveFetchError liveError) {
        this.city = Objects.requireNonNull(city, "city must not be null");
        this.rawSummary = cityResult.rawSummary();
        this.smoothedSummary = cityResult.smoothedSummary();
        this.seasonalStats = Collections.unmodifiableList(
                new ArrayList<>(cityResult.getSeasonalStats().values()));
        this.anomalies = cityResult.getAnomalies();
        this.live = live;
        this.liveError = liveError;
    }

    /**
     * @param city       the reported city
     * @param cityResult analysis result already narrowed to {@code city}
     * @return a report without live data
     */
    public static AnalysisReport historical(String city, AnalysisResult cityResult) {
        return new AnalysisReport(city, cityResult, null, null);
    }

    /**
     * @param city       the reported city
     * @param cityResult analysis result already narrowed to {@code city}
     * @param live       classification of the live reading
     * @return a report with a classified live reading
     */
    public static AnalysisReport withLive(String city, AnalysisResult cityResult,
            LiveClassification live) {
        return new AnalysisReport(city, cityResult,
                Objects.requireNonNull(live, "live must not be null"), null);
    }

    /**
     * @param city       the reported city
     * @param cityResult analysis result already narrowed to {@code city}
     * @param error      why no live reading is available
     * @return a report carrying the live-fetch error next to the historical
     *         tables
     */
    public static AnalysisReport withLiveError(String city, AnalysisResult cityResult,
            LiveFetchError error) {
        return new AnalysisReport(city, cityResult, null,
                Objects.requireNonNull(error, "error must not be null"));
    }

    public String getCity() {
        return city;
    }

    public DescriptiveStatistics getRawSummary() {
        return rawSummary;
    }

    public DescriptiveStatistics getSmoothedSummary() {
        return smoothedSummary;
    }

    public List<SeasonalStat> getSeasonalStats() {
        return seasonalStats;
    }

    public List<TemperatureRecord> getAnomalies() {
        return anomalies;
    }

    public LiveClassification getLive() {
        return live;
    }

    public LiveFetchError getLiveError() {
        return liveError;
    }

    @Override
    public String toString() {
        return "AnalysisReport{" +
                "city='" + city + '\'' +
                ", seasonalStats=" + seasonalStats.size() +
                ", anomalies=" + anomalies.size() +
                ", live=" + live +
                ", liveError=" + liveError +
                '}';
    }
}
