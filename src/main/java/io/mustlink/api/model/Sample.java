package io.mustlink.api.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One telemetry sample. The calibrated value is {@code null} when calibration was not requested.
 */
public class Sample {

    private final Instant timestamp;
    private final Object rawValue;
    private final Object calibratedValue;

    public Sample(Instant timestamp, Object rawValue, Object calibratedValue) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.rawValue = rawValue;
        this.calibratedValue = calibratedValue;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Object getRawValue() {
        return rawValue;
    }

    public Object getCalibratedValue() {
        return calibratedValue;
    }

    public boolean hasCalibratedValue() {
        return calibratedValue != null;
    }

    /** Calibrated value when asked for and present, raw value otherwise. */
    public Object getValue(boolean calibrated) {
        return calibrated && calibratedValue != null ? calibratedValue : rawValue;
    }

    public Sample withoutCalibration() {
        return calibratedValue == null ? this : new Sample(timestamp, rawValue, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sample)) {
            return false;
        }
        Sample other = (Sample) o;
        return timestamp.equals(other.timestamp)
                && Objects.equals(rawValue, other.rawValue)
                && Objects.equals(calibratedValue, other.calibratedValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, rawValue, calibratedValue);
    }

    @Override
    public String toString() {
        return timestamp + "=" + rawValue + (calibratedValue != null ? " (" + calibratedValue + ")" : "");
    }
}
