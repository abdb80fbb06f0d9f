/**
 * Seasonal anomaly detection over the smoothed series.
 *
 * <p>
 * {@link com.thermosentinel.core.detection.AnomalyDetector} flags records
 * outside {@code mean ± k × σ} of their (city, season) baseline, as computed
 * by {@link com.thermosentinel.core.stats.SeasonalStatsCalculator}.
 * </p>
 *
 * @since 1.0.0
 */
package com.thermosentinel.core.detection;
