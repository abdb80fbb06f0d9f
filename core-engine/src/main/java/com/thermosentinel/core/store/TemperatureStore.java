package com.thermosentinel.core.store;

import com.thermosentinel.core.model.TemperatureRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, in-memory snapshot of the ingested temperature records.
 *
 * <p>
 * The store keeps records in ingestion order. It is the single input of an
 * analysis run; nothing in the pipeline mutates it.
 * </p>
 *
 * @since 1.0.0
 */
public final class TemperatureStore {

    private final List<TemperatureRecord> records;

    private TemperatureStore(List<TemperatureRecord> records) {
        this.records = Collections.unmodifiableList(records);
    }

    /**
     * Create a store from already parsed records.
     *
     * @param records the records in ingestion order; must not be {@code null}
     * @return a new store
     * @throws NullPointerException if {@code records} is {@code null}
     * @throws IngestionException   if the list is empty, contains
     *                              {@code null}, or a raw temperature is not
     *                              a finite number
     */
    public static TemperatureStore of(List<TemperatureRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        if (records.isEmpty()) {
            throw new IngestionException("Dataset contains no temperature records");
        }
        List<TemperatureRecord> copy = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            TemperatureRecord record = records.get(i);
            if (record == null) {
                throw new IngestionException("Record at index " + i + " is null");
            }
            if (!Double.isFinite(record.getRawTemperature())) {
                throw new IngestionException("Record at index " + i
                        + " has a non-finite temperature: " + record.getRawTemperature());
            }
            copy.add(record);
        }
        return new TemperatureStore(copy);
    }

    /**
     * @return unmodifiable list of all records in ingestion order
     */
    public List<TemperatureRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    /**
     * @return city names in order of first appearance
     */
    public Set<String> cities() {
        Set<String> cities = new LinkedHashSet<>();
        for (TemperatureRecord record : records) {
            cities.add(record.getCity());
        }
        return Collections.unmodifiableSet(cities);
    }

    /**
     * @param city the city name
     * @return {@code true} if at least one record belongs to the city
     */
    public boolean containsCity(String city) {
        return records.stream().anyMatch(r -> r.getCity().equals(city));
    }

    /**
     * @param city the city name
     * @return the city's records in ingestion order
     */
    public List<TemperatureRecord> forCity(String city) {
        return records.stream()
                .filter(r -> r.getCity().equals(city))
                .toList();
    }

    /**
     * Return the chronologically latest record of a city. On a timestamp tie
     * the record that comes first in ingestion order wins.
     *
     * @param city the city name
     * @return the latest record, or empty if the city is unknown
     */
    public Optional<TemperatureRecord> latest(String city) {
        return latest(records, city);
    }

    /**
     * Same as {@link #latest(String)} over an arbitrary record sequence.
     *
     * @param records the records to search
     * @param city    the city name
     * @return the latest record of the city, or empty if none
     */
    public static Optional<TemperatureRecord> latest(List<TemperatureRecord> records, String city) {
        TemperatureRecord latest = null;
        for (TemperatureRecord record : records) {
            if (!record.getCity().equals(city)) {
                continue;
            }
            if (latest == null || record.getTimestamp().isAfter(latest.getTimestamp())) {
                latest = record;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public String toString() {
        return "TemperatureStore{records=" + records.size() + ", cities=" + cities() + '}';
    }
}
