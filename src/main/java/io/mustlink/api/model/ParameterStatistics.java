package io.mustlink.api.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Statistics the service computed for one parameter over a window.
 */
public class ParameterStatistics {

    private final String parameter;
    private final Instant from;
    private final Instant to;
    private final Map<String, Object> values;

    public ParameterStatistics(String parameter, Instant from, Instant to, Map<String, Object> values) {
        this.parameter = parameter;
        this.from = from;
        this.to = to;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String getParameter() {
        return parameter;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    /** Remaining statistic fields (min, max, average, count, ...) as returned. */
    public Map<String, Object> getValues() {
        return values;
    }

    /** Numeric statistic, or {@code null} when absent or not numeric. */
    public Double getDouble(String key) {
        Object value = values.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.valueOf((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
