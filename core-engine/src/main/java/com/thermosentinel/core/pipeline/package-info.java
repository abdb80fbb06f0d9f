/**
 * End-to-end batch pipeline: smoothing, seasonal baselines and anomaly
 * detection over one {@link com.thermosentinel.core.store.TemperatureStore}.
 *
 * @since 1.0.0
 */
package com.thermosentinel.core.pipeline;
