package com.thermosentinel.core.smoothing;

import com.thermosentinel.core.model.TemperatureRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Trailing moving-average smoother.
 *
 * <p>
 * Records are first partitioned by city, then each partition is sorted by
 * timestamp and smoothed on its own. A window therefore never spans two
 * cities.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * The first {@code windowSize - 1} records of every city have fewer than
 * {@code windowSize} observations behind them. They are returned with an
 * absent smoothed temperature instead of a partial average.
 * </p>
 *
 * <h3>Output order</h3>
 * <p>
 * Cities appear in order of first appearance in the input; within a city
 * records are ascending by timestamp (stable for equal timestamps).
 * </p>
 *
 * @since 1.0.0
 */
public class Smoother {

    private static final Logger LOG = LoggerFactory.getLogger(Smoother.class);

    private static final Comparator<TemperatureRecord> BY_TIMESTAMP =
            Comparator.comparing(TemperatureRecord::getTimestamp);

    private final int windowSize;

    /**
     * @param windowSize number of trailing same-city records to average
     * @throws IllegalArgumentException if {@code windowSize < 1}
     */
    public Smoother(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    /**
     * Smooth the raw temperatures of every city independently.
     *
     * @param records records of one or more cities, in any order; must not be
     *                {@code null}
     * @return new records carrying the smoothed temperature, grouped by city
     *         and ordered by timestamp; the input is left untouched
     */
    public List<TemperatureRecord> smooth(List<TemperatureRecord> records) {
        Objects.requireNonNull(records, "records must not be null");

        List<TemperatureRecord> result = new ArrayList<>(records.size());
        for (Map.Entry<String, List<TemperatureRecord>> partition : partitionByCity(records).entrySet()) {
            List<TemperatureRecord> cityRecords = partition.getValue();
            cityRecords.sort(BY_TIMESTAMP);
            result.addAll(smoothCity(cityRecords));
            LOG.debug("Smoothed {} record(s) for city '{}'", cityRecords.size(), partition.getKey());
        }

        LOG.info("Smoothed {} record(s) with window {}", result.size(), windowSize);
        return result;
    }

    public int getWindowSize() {
        return windowSize;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Map<String, List<TemperatureRecord>> partitionByCity(List<TemperatureRecord> records) {
        Map<String, List<TemperatureRecord>> partitions = new LinkedHashMap<>();
        for (TemperatureRecord record : records) {
            partitions.computeIfAbsent(record.getCity(), c -> new ArrayList<>()).add(record);
        }
        return partitions;
    }

    /** Expects records of a single city, already in time order. */
    private List<TemperatureRecord> smoothCity(List<TemperatureRecord> cityRecords) {
        List<TemperatureRecord> smoothed = new ArrayList<>(cityRecords.size());
        Deque<Double> window = new ArrayDeque<>(windowSize);

        for (TemperatureRecord record : cityRecords) {
            window.addLast(record.getRawTemperature());
            if (window.size() > windowSize) {
                window.pollFirst();
            }

            if (window.size() == windowSize) {
                smoothed.add(record.withSmoothedTemperature(mean(window)));
            } else {
                smoothed.add(record.withoutSmoothedTemperature());
            }
        }
        return smoothed;
    }

    // Recomputed from the window contents on every step, no running total.
    private static double mean(Deque<Double> window) {
        double sum = 0;
        for (double v : window) {
            sum += v;
        }
        return sum / window.size();
    }
}
