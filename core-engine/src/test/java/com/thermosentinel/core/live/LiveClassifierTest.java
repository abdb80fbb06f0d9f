package com.thermosentinel.core.live;

import com.thermosentinel.core.model.Classification;
import com.thermosentinel.core.model.IndeterminateReason;
import com.thermosentinel.core.model.LiveClassification;
import com.thermosentinel.core.model.SeasonKey;
import com.thermosentinel.core.model.SeasonalStat;
import com.thermosentinel.core.model.TemperatureRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LiveClassifier}.
 */
class LiveClassifierTest {

    private final LiveClassifier classifier = new LiveClassifier(2.0);

    @Test
    @DisplayName("Live 5.0 against mean 0.0 / stddev 1.0 should be anomalous")
    void shouldClassifyAnomalous() {
        SeasonalStat baseline = new SeasonalStat(SeasonKey.of("A", "winter"), 30, 0.0, 1.0);

        LiveClassification result = classifier.classify("A", 5.0, baseline);

        assertThat(result.getStatus()).isEqualTo(Classification.ANOMALOUS);
        assertThat(result.getTemperature()).isEqualTo(5.0);
        assertThat(result.getSeason()).isEqualTo("winter");
        assertThat(result.getReason()).isNull();
    }

    @Test
    @DisplayName("A reading exactly on the band edge should be normal")
    void shouldTreatBandEdgeAsNormal() {
        SeasonalStat baseline = new SeasonalStat(SeasonKey.of("A", "winter"), 30, 0.0, 1.0);

        assertThat(classifier.classify("A", 2.0, baseline).getStatus())
                .isEqualTo(Classification.NORMAL);
        assertThat(classifier.classify("A", -2.0, baseline).getStatus())
                .isEqualTo(Classification.NORMAL);
    }

    @Test
    @DisplayName("Should use the season of the city's latest record")
    void shouldUseLatestSeason() {
        List<TemperatureRecord> records = List.of(
                record("A", "winter", "2024-02-20T00:00:00Z"),
                record("A", "spring", "2024-03-02T00:00:00Z"),
                record("A", "winter", "2024-02-28T00:00:00Z"),
                record("B", "summer", "2024-06-01T00:00:00Z"));
        Map<SeasonKey, SeasonalStat> baselines = Map.of(
                SeasonKey.of("A", "winter"), new SeasonalStat(SeasonKey.of("A", "winter"), 10, 0.0, 1.0),
                SeasonKey.of("A", "spring"), new SeasonalStat(SeasonKey.of("A", "spring"), 10, 10.0, 2.0));

        LiveClassification result = classifier.classify("A", 11.0, records, baselines);

        assertThat(classifier.currentSeason("A", records)).hasValue("spring");
        assertThat(result.getSeason()).isEqualTo("spring");
        assertThat(result.getStatus()).isEqualTo(Classification.NORMAL);
    }

    @Test
    @DisplayName("Missing stat for the current season should be indeterminate")
    void shouldReportNoBaselineForSeason() {
        List<TemperatureRecord> records = List.of(record("A", "autumn", "2024-10-01T00:00:00Z"));
        Map<SeasonKey, SeasonalStat> baselines = Map.of(
                SeasonKey.of("A", "winter"), new SeasonalStat(SeasonKey.of("A", "winter"), 10, 0.0, 1.0));

        LiveClassification result = classifier.classify("A", 0.0, records, baselines);

        assertThat(result.getStatus()).isEqualTo(Classification.INDETERMINATE);
        assertThat(result.getReason()).isEqualTo(IndeterminateReason.NO_BASELINE_FOR_SEASON);
        assertThat(result.getSeason()).isEqualTo("autumn");
    }

    @Test
    @DisplayName("Unknown city should be indeterminate")
    void shouldReportUnknownCityAsNoBaseline() {
        LiveClassification result = classifier.classify("Nowhere", 12.0, List.of(), Map.of());

        assertThat(result.getStatus()).isEqualTo(Classification.INDETERMINATE);
        assertThat(result.getReason()).isEqualTo(IndeterminateReason.NO_BASELINE_FOR_SEASON);
        assertThat(result.getSeason()).isNull();
    }

    @Test
    @DisplayName("Single-sample baseline should be indeterminate, never normal")
    void shouldReportUndefinedBaseline() {
        SeasonalStat single = new SeasonalStat(SeasonKey.of("A", "winter"), 1, 0.0, null);

        LiveClassification result = classifier.classify("A", 0.0, single);

        assertThat(result.getStatus()).isEqualTo(Classification.INDETERMINATE);
        assertThat(result.getReason()).isEqualTo(IndeterminateReason.UNDEFINED_BASELINE);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TemperatureRecord record(String city, String season, String timestamp) {
        return TemperatureRecord.builder()
                .city(city)
                .season(season)
                .timestamp(Instant.parse(timestamp))
                .rawTemperature(0)
                .build();
    }
}
