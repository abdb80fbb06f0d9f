package com.thermosentinel.core.store;

/**
 * Thrown when input rows cannot be turned into a usable
 * {@link TemperatureStore}: a required column is missing, a value cannot be
 * parsed, or the dataset is empty.
 *
 * <p>
 * Ingestion failures are fatal to an analysis run.
 * </p>
 *
 * @since 1.0.0
 */
public class IngestionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
