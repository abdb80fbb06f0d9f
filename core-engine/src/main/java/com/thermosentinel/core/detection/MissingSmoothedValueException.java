package com.thermosentinel.core.detection;

import com.thermosentinel.core.model.TemperatureRecord;

/**
 * Thrown when a stage that needs a record's smoothed temperature is handed a
 * record that has none (insufficient history, or never smoothed).
 *
 * @since 1.0.0
 */
public class MissingSmoothedValueException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient TemperatureRecord record;

    public MissingSmoothedValueException(TemperatureRecord record) {
        super("No smoothed temperature for " + record.getCity() + " at " + record.getTimestamp());
        this.record = record;
    }

    public TemperatureRecord getRecord() {
        return record;
    }
}
