package io.mustlink.api.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive metadata for one telemetry parameter.
 * Sample bounds are {@code null} when the service reports that no sample was ever recorded.
 */
public class ParameterInfo {

    public static final String NAME = "Name";
    public static final String DESCRIPTION = "Description";
    public static final String UNIT = "Unit";
    public static final String FIRST_SAMPLE = "First Sample";
    public static final String LAST_SAMPLE = "Last Sample";

    private final String name;
    private final String description;
    private final String unit;
    private final Instant firstSample;
    private final Instant lastSample;
    private final MonitoringLimits limits;
    private final Map<String, Object> attributes;

    public ParameterInfo(String name, String description, String unit, Instant firstSample,
            Instant lastSample, MonitoringLimits limits, Map<String, Object> attributes) {
        this.name = name;
        this.description = description;
        this.unit = unit;
        this.firstSample = firstSample;
        this.lastSample = lastSample;
        this.limits = limits != null ? limits : MonitoringLimits.none();
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getUnit() {
        return unit;
    }

    public Instant getFirstSample() {
        return firstSample;
    }

    public Instant getLastSample() {
        return lastSample;
    }

    public MonitoringLimits getLimits() {
        return limits;
    }

    public Double getSoftLow() {
        return limits.getSoftLow();
    }

    public Double getSoftHigh() {
        return limits.getSoftHigh();
    }

    public Double getHardLow() {
        return limits.getHardLow();
    }

    public Double getHardHigh() {
        return limits.getHardHigh();
    }

    public Boolean getCheckCalibrated() {
        return limits.getCheckCalibrated();
    }

    public String getCheckInterpretation() {
        return limits.getCheckInterpretation();
    }

    /** All descriptive fields as returned by the service, sample bounds unparsed. */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return name + " (" + description + ")";
    }
}
