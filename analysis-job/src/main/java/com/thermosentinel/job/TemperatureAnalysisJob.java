package com.thermosentinel.job;

import com.thermosentinel.core.config.AnalysisConfig;
import com.thermosentinel.core.config.AnalysisConfigLoader;
import com.thermosentinel.core.live.LiveFetchError;
import com.thermosentinel.core.live.LiveFetchResult;
import com.thermosentinel.core.live.WeatherClient;
import com.thermosentinel.core.model.LiveClassification;
import com.thermosentinel.core.pipeline.AnalysisResult;
import com.thermosentinel.core.pipeline.TemperatureAnalysis;
import com.thermosentinel.core.store.IngestionException;
import com.thermosentinel.core.store.TemperatureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Main entry point for the Thermo Sentinel analysis job.
 *
 * <h3>Run</h3>
 *
 * <pre>
 *   CSV file
 *     → TemperatureCsvReader → TemperatureStore
 *     → TemperatureAnalysis (smoothing, seasonal baselines, anomalies)
 *     → narrow to the selected city
 *     → live reading (fetched concurrently, bounded by a timeout)
 *     → AnalysisReport → JSON
 * </pre>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * Ingestion errors abort the run. A failed, rejected or timed-out live fetch
 * only replaces the live classification with a {@link LiveFetchError}; the
 * historical tables are reported in full either way.
 * </p>
 *
 * @since 1.0.0
 */
public final class TemperatureAnalysisJob {

    private static final Logger LOG = LoggerFactory.getLogger(TemperatureAnalysisJob.class);

    /** Slack on top of the HTTP timeout before the job gives up on the reading. */
    private static final Duration AWAIT_GRACE = Duration.ofSeconds(1);

    private final JobConfig config;
    private final TemperatureAnalysis analysis;
    private final TemperatureCsvReader reader;
    private final WeatherClient weatherClient;

    public TemperatureAnalysisJob(JobConfig config, AnalysisConfig analysisConfig,
            WeatherClient weatherClient) {
        this(config, analysisConfig, new TemperatureCsvReader(), weatherClient);
    }

    TemperatureAnalysisJob(JobConfig config, AnalysisConfig analysisConfig,
            TemperatureCsvReader reader, WeatherClient weatherClient) {
        this.config = Objects.requireNonNull(config, "JobConfig must not be null");
        this.analysis = new TemperatureAnalysis(
                Objects.requireNonNull(analysisConfig, "AnalysisConfig must not be null"));
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.weatherClient = Objects.requireNonNull(weatherClient, "weatherClient must not be null");
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Thermo Sentinel with config: {}", config);
        AnalysisConfig analysisConfig = loadAnalysisConfig(config);

        // 2. Wire the live-reading client
        WeatherClient weatherClient = new OpenWeatherMapClient(
                config.getWeatherBaseUrl(), config.getWeatherTimeout());

        // 3. Run
        AnalysisReport report;
        try {
            report = new TemperatureAnalysisJob(config, analysisConfig, weatherClient).run();
        } catch (IngestionException e) {
            LOG.error("Ingestion failed, no analysis produced: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        // 4. Publish
        ReportWriter writer = new ReportWriter();
        String reportPath = config.getReportPath();
        if (reportPath.isBlank()) {
            writer.write(report, System.out);
        } else {
            writer.write(report, Path.of(reportPath));
            LOG.info("Report written to {}", reportPath);
        }
    }

    /**
     * Run the job once.
     *
     * @return the report for the selected city
     * @throws IngestionException       if the input file cannot be ingested
     * @throws IllegalArgumentException if the configured city is not in the
     *                                  dataset
     */
    public AnalysisReport run() {
        TemperatureStore store = reader.read(Path.of(config.getDataPath()));
        String city = selectCity(store);

        // Started before the batch pipeline; the two do not depend on each other.
        CompletableFuture<LiveFetchResult> liveFetch = config.isLiveFetchEnabled()
                ? weatherClient.fetch(city, config.getApiKey())
                : null;

        AnalysisResult cityResult;
        try {
            cityResult = analysis.analyze(store).forCity(city);
        } catch (RuntimeException e) {
            if (liveFetch != null) {
                liveFetch.cancel(true);
            }
            throw e;
        }

        if (liveFetch == null) {
            LOG.info("No API key configured; skipping live reading");
            return AnalysisReport.historical(city, cityResult);
        }

        LiveFetchResult live = await(city, liveFetch);
        if (!live.isSuccess()) {
            LiveFetchError error = live.getError().orElseThrow();
            LOG.warn("Live reading unavailable for '{}': {}", city, error.getMessage());
            return AnalysisReport.withLiveError(city, cityResult, error);
        }

        LiveClassification classification =
                cityResult.classifyLive(city, live.getTemperature().getAsDouble());
        LOG.info("Live classification: {}", classification);
        return AnalysisReport.withLive(city, cityResult, classification);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private String selectCity(TemperatureStore store) {
        String city = config.getCity();
        if (city.isBlank()) {
            String first = store.cities().iterator().next();
            LOG.info("No city configured; reporting on '{}'", first);
            return first;
        }
        if (!store.containsCity(city)) {
            throw new IllegalArgumentException("City '" + city
                    + "' is not in the dataset; available: " + store.cities());
        }
        return city;
    }

    private LiveFetchResult await(String city, CompletableFuture<LiveFetchResult> liveFetch) {
        long waitMs = config.getWeatherTimeout().plus(AWAIT_GRACE).toMillis();
        try {
            return liveFetch.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            liveFetch.cancel(true);
            return LiveFetchResult.failure(city,
                    LiveFetchError.of("Live reading not received within " + waitMs + " ms"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Weather client completed exceptionally for '{}'", city, cause);
            return LiveFetchResult.failure(city,
                    LiveFetchError.of("Live reading failed: " + cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            liveFetch.cancel(true);
            return LiveFetchResult.failure(city, LiveFetchError.of("Live reading interrupted"));
        }
    }

    private static AnalysisConfig loadAnalysisConfig(JobConfig config) {
        String path = config.getAnalysisConfigPath();
        if (path != null && !path.isBlank()) {
            return AnalysisConfigLoader.fromFile(path);
        }
        return AnalysisConfigLoader.load();
    }
}
