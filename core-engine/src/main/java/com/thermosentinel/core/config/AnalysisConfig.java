package com.thermosentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable parameters of the analysis pipeline.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * windowSize: 30
 * deviationFactor: 2.0
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that every value is within its legal range.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_WINDOW_SIZE = 30;
    public static final double DEFAULT_DEVIATION_FACTOR = 2.0;

    /** Number of trailing same-city samples averaged into one smoothed value. */
    private int windowSize = DEFAULT_WINDOW_SIZE;

    /** Number of baseline standard deviations that separates normal from anomalous. */
    private double deviationFactor = DEFAULT_DEVIATION_FACTOR;

    /**
     * @return a configuration holding the default values
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    /**
     * @param windowSize      smoothing window
     * @param deviationFactor anomaly threshold in standard deviations
     * @return a validated configuration
     * @throws IllegalStateException if a value is out of range
     */
    public static AnalysisConfig of(int windowSize, double deviationFactor) {
        AnalysisConfig config = new AnalysisConfig();
        config.setWindowSize(windowSize);
        config.setDeviationFactor(deviationFactor);
        config.validate();
        return config;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate all values, collecting every problem into one message.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (windowSize < 1) {
            errors.add("'windowSize' must be >= 1, got: " + windowSize);
        }
        if (!(deviationFactor > 0) || Double.isInfinite(deviationFactor)) {
            errors.add("'deviationFactor' must be a finite number > 0, got: " + deviationFactor);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AnalysisConfig: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required by SnakeYAML)
    // ---------------------------------------------------------------

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }

    public void setDeviationFactor(double deviationFactor) {
        this.deviationFactor = deviationFactor;
    }

    @Override
    public String toString() {
        return "AnalysisConfig{" +
                "windowSize=" + windowSize +
                ", deviationFactor=" + deviationFactor +
                '}';
    }
}
