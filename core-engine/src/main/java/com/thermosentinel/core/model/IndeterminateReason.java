package com.thermosentinel.core.model;

/**
 * Why a live reading could not be classified.
 *
 * @since 1.0.0
 */
public enum IndeterminateReason {

    /** The city's current season has no {@link SeasonalStat}. */
    NO_BASELINE_FOR_SEASON,

    /** The {@link SeasonalStat} exists but has fewer than two samples. */
    UNDEFINED_BASELINE
}
