/**
 * Grouped baseline statistics and column summaries.
 *
 * @since 1.0.0
 */
package com.thermosentinel.core.stats;
