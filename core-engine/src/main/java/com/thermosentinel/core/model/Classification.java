package com.thermosentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of classifying a live reading against a seasonal baseline.
 *
 * @since 1.0.0
 */
public enum Classification {

    /** Within {@code mean ± k·stddev}. */
    NORMAL("normal"),

    /** Outside {@code mean ± k·stddev}. */
    ANOMALOUS("anomalous"),

    /** No usable baseline exists; see {@link IndeterminateReason}. */
    INDETERMINATE("indeterminate");

    private final String label;

    Classification(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
