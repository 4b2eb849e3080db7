package io.mustlink.api.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Several parameters' samples merged on the union of their timestamps.
 * A parameter without a sample at a given timestamp is absent there, never zero.
 */
public class AlignedSeries {

    private final List<String> parameters = new ArrayList<>();
    private final NavigableMap<Instant, Map<String, Sample>> rows = new TreeMap<>();
    private final boolean calibrated;

    public AlignedSeries(boolean calibrated) {
        this.calibrated = calibrated;
    }

    /**
     * Outer-join one parameter's samples into the series.
     */
    public void addParameter(String name, List<Sample> samples) {
        if (parameters.contains(name)) {
            throw new IllegalArgumentException("parameter already aligned: " + name);
        }
        parameters.add(name);
        for (Sample sample : samples) {
            rows.computeIfAbsent(sample.getTimestamp(), t -> new LinkedHashMap<>()).put(name, sample);
        }
    }

    public List<String> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public boolean isCalibrated() {
        return calibrated;
    }

    public List<Instant> getTimestamps() {
        return new ArrayList<>(rows.keySet());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** The sample of {@code parameter} at {@code timestamp}, or {@code null} when absent. */
    public Sample getSample(String parameter, Instant timestamp) {
        Map<String, Sample> row = rows.get(timestamp);
        return row != null ? row.get(parameter) : null;
    }

    /** The value at {@code timestamp}, calibrated if the series was fetched calibrated. */
    public Object getValue(String parameter, Instant timestamp) {
        Sample sample = getSample(parameter, timestamp);
        return sample != null ? sample.getValue(calibrated) : null;
    }

    /** All samples of one parameter in time order. */
    public List<Sample> getSamples(String parameter) {
        List<Sample> samples = new ArrayList<>();
        for (Map<String, Sample> row : rows.values()) {
            Sample sample = row.get(parameter);
            if (sample != null) {
                samples.add(sample);
            }
        }
        return samples;
    }

    /** Rows as timestamp to (parameter to value), absent parameters omitted. */
    public Map<Instant, Map<String, Object>> toValueTable() {
        Map<Instant, Map<String, Object>> table = new LinkedHashMap<>();
        rows.forEach((timestamp, row) -> {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String parameter : parameters) {
                Sample sample = row.get(parameter);
                if (sample != null) {
                    values.put(parameter, sample.getValue(calibrated));
                }
            }
            table.put(timestamp, values);
        });
        return table;
    }
}
