/**
 * Domain model classes for Thermo Sentinel.
 *
 * <p>
 * This package contains the value types shared between the analysis pipeline
 * and the job layer:
 * </p>
 * <ul>
 * <li>{@link com.thermosentinel.core.model.TemperatureRecord}: one daily
 * observation, raw and smoothed</li>
 * <li>{@link com.thermosentinel.core.model.SeasonKey}: (city, season)
 * grouping key</li>
 * <li>{@link com.thermosentinel.core.model.SeasonalStat}: baseline mean and
 * sample stddev of a group</li>
 * <li>{@link com.thermosentinel.core.model.LiveClassification}: live reading
 * classified against the current season</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.thermosentinel.core.model;
