/**
 * Per-city trailing moving average.
 *
 * @since 1.0.0
 */
package com.thermosentinel.core.smoothing;
