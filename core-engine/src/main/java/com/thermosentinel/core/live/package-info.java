/**
 * Live reading contract and classification.
 *
 * <p>
 * {@link com.thermosentinel.core.live.WeatherClient} is implemented outside
 * the core; the core only consumes its
 * {@link com.thermosentinel.core.live.LiveFetchResult}.
 * </p>
 *
 * @since 1.0.0
 */
package com.thermosentinel.core.live;
