package com.thermosentinel.job;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the analysis job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a shell, a container {@code -e} flag or a
 * scheduler without a config file.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String DEFAULT_WEATHER_BASE_URL =
            "https://api.openweathermap.org/data/2.5/weather";

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final String dataPath;
    private final String reportPath;
    private final String analysisConfigPath;

    // ---------------------------------------------------------------
    // City selection and live reading
    // ---------------------------------------------------------------
    private final String city;
    private final String apiKey;
    private final String weatherBaseUrl;
    private final long weatherTimeoutMs;

    private JobConfig(Builder b) {
        this.dataPath = b.dataPath;
        this.reportPath = b.reportPath;
        this.analysisConfigPath = b.analysisConfigPath;
        this.city = b.city;
        this.apiKey = b.apiKey;
        this.weatherBaseUrl = b.weatherBaseUrl;
        this.weatherTimeoutMs = b.weatherTimeoutMs;
    }

    // ---------------------------------------------------------------
    // Factory (environment)
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .dataPath(env("DATA_PATH", ""))
                    .reportPath(env("REPORT_PATH", ""))
                    .analysisConfigPath(env("ANALYSIS_CONFIG_PATH", ""))
                    .city(env("CITY", ""))
                    .apiKey(env("OPENWEATHER_API_KEY", ""))
                    .weatherBaseUrl(env("WEATHER_BASE_URL", DEFAULT_WEATHER_BASE_URL))
                    .weatherTimeoutMs(parseLongEnv("WEATHER_TIMEOUT_MS", "10000"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDataPath() {
        return dataPath;
    }

    /**
     * @return report file path; blank means standard output
     */
    public String getReportPath() {
        return reportPath;
    }

    /**
     * @return YAML file for the analysis parameters; blank means the default
     *         resolution of {@code AnalysisConfigLoader.load()}
     */
    public String getAnalysisConfigPath() {
        return analysisConfigPath;
    }

    /**
     * @return city to report on; blank means the first city of the dataset
     */
    public String getCity() {
        return city;
    }

    public String getApiKey() {
        return apiKey;
    }

    /**
     * @return {@code true} if an API key is configured and a live reading
     *         should be fetched
     */
    public boolean isLiveFetchEnabled() {
        return !apiKey.isBlank();
    }

    public String getWeatherBaseUrl() {
        return weatherBaseUrl;
    }

    public Duration getWeatherTimeout() {
        return Duration.ofMillis(weatherTimeoutMs);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method requires a non-blank data path, an absolute
     * http(s) weather URL and a positive timeout. Optional strings default to
     * blank, never {@code null}.
     * </p>
     */
    public static class Builder {
        private String dataPath;
        private String reportPath = "";
        private String analysisConfigPath = "";
        private String city = "";
        private String apiKey = "";
        private String weatherBaseUrl = DEFAULT_WEATHER_BASE_URL;
        private long weatherTimeoutMs = 10_000;

        public Builder dataPath(String v) {
            this.dataPath = v;
            return this;
        }

        public Builder reportPath(String v) {
            this.reportPath = v;
            return this;
        }

        public Builder analysisConfigPath(String v) {
            this.analysisConfigPath = v;
            return this;
        }

        public Builder city(String v) {
            this.city = v;
            return this;
        }

        public Builder apiKey(String v) {
            this.apiKey = v;
            return this;
        }

        public Builder weatherBaseUrl(String v) {
            this.weatherBaseUrl = v;
            return this;
        }

        public Builder weatherTimeoutMs(long v) {
            this.weatherTimeoutMs = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            if (dataPath == null || dataPath.isBlank()) {
                throw new IllegalArgumentException("dataPath must not be null or blank");
            }
            reportPath = Objects.requireNonNullElse(reportPath, "");
            analysisConfigPath = Objects.requireNonNullElse(analysisConfigPath, "");
            city = Objects.requireNonNullElse(city, "").trim();
            apiKey = Objects.requireNonNullElse(apiKey, "").trim();

            if (weatherTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "weatherTimeoutMs must be >= 1, got: " + weatherTimeoutMs);
            }
            requireHttpUrl(weatherBaseUrl);

            return new JobConfig(this);
        }

        private static void requireHttpUrl(String url) {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("weatherBaseUrl must not be null or blank");
            }
            URI uri;
            try {
                uri = URI.create(url);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("weatherBaseUrl is not a valid URI: " + url, e);
            }
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new IllegalArgumentException(
                        "weatherBaseUrl must be an http(s) URL, got: " + url);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "dataPath='" + dataPath + '\'' +
                ", reportPath='" + reportPath + '\'' +
                ", analysisConfigPath='" + analysisConfigPath + '\'' +
                ", city='" + city + '\'' +
                ", apiKey=" + (apiKey.isBlank() ? "<none>" : "<set>") +
                ", weatherBaseUrl='" + weatherBaseUrl + '\'' +
                ", weatherTimeoutMs=" + weatherTimeoutMs +
                '}';
    }
}
