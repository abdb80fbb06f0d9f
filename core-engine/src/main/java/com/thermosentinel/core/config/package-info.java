/**
 * Configuration loading and validation for the analysis pipeline.
 *
 * <p>
 * Parameters are defined in YAML and loaded by
 * {@link com.thermosentinel.core.config.AnalysisConfigLoader} into an
 * {@link com.thermosentinel.core.config.AnalysisConfig} instance. Validation
 * runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.thermosentinel.core.config;
