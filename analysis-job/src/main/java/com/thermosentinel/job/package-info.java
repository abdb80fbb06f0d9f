/**
 * Runnable analysis job for Thermo Sentinel.
 *
 * <p>
 * This package wires the core pipeline to its surroundings: it reads the CSV
 * input, fetches the live reading over HTTP, runs the analysis for one city
 * and writes the JSON report.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.thermosentinel.job.TemperatureAnalysisJob}: main entry
 * point</li>
 * <li>{@link com.thermosentinel.job.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.thermosentinel.job.TemperatureCsvReader}: CSV
 * ingestion</li>
 * <li>{@link com.thermosentinel.job.OpenWeatherMapClient}: live reading over
 * HTTP</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.thermosentinel.job;
