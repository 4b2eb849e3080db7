package io.mustlink.api.model;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A service-defined limit check attached to a parameter.
 */
public class MonitoringCheck {

    public enum CheckType {
        SOFT,
        HARD,
        UNSUPPORTED;

        static CheckType fromString(String value) {
            if (value != null) {
                String normalized = value.trim().toUpperCase(Locale.ROOT);
                if (SOFT.name().equals(normalized)) {
                    return SOFT;
                }
                if (HARD.name().equals(normalized)) {
                    return HARD;
                }
            }
            return UNSUPPORTED;
        }
    }

    private final CheckType type;
    private final String rawType;
    private final Object lowValue;
    private final Object highValue;
    private final Boolean useCalibrated;
    private final String interpretation;

    public MonitoringCheck(CheckType type, Object lowValue, Object highValue,
            Boolean useCalibrated, String interpretation) {
        this(type, type.name(), lowValue, highValue, useCalibrated, interpretation);
    }

    private MonitoringCheck(CheckType type, String rawType, Object lowValue, Object highValue,
            Boolean useCalibrated, String interpretation) {
        this.type = type;
        this.rawType = rawType;
        this.lowValue = lowValue;
        this.highValue = highValue;
        this.useCalibrated = useCalibrated;
        this.interpretation = interpretation;
    }

    /**
     * Read one entry of a complex parameter record's {@code monitoringChecks} list:
     * {@code {useCalibrated, checkInterpretation, checkDefinitions: {type, lowValue, highValue}}}.
     * Limits are kept as sent; only soft and hard limits are numeric.
     */
    @SuppressWarnings("unchecked")
    public static MonitoringCheck fromResponse(Map<String, Object> raw) {
        Object definitions = raw.get("checkDefinitions");
        if (definitions instanceof List && !((List<?>) definitions).isEmpty()) {
            definitions = ((List<?>) definitions).get(0);
        }
        Map<String, Object> details = definitions instanceof Map
                ? (Map<String, Object>) definitions
                : Map.of();

        Object rawType = details.get("type");
        String typeText = rawType != null ? rawType.toString() : null;
        return new MonitoringCheck(
                CheckType.fromString(typeText),
                typeText,
                details.get("lowValue"),
                details.get("highValue"),
                toBoolean(raw.get("useCalibrated")),
                raw.get("checkInterpretation") != null ? raw.get("checkInterpretation").toString() : null);
    }

    private static Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.valueOf(value.toString().trim());
    }

    public CheckType getType() {
        return type;
    }

    /** Check type exactly as the service named it. */
    public String getRawType() {
        return rawType;
    }

    /** Low limit exactly as the service sent it. */
    public Object getLowValue() {
        return lowValue;
    }

    public Object getHighValue() {
        return highValue;
    }

    /**
     * Low limit as a number, {@code null} when absent.
     *
     * @throws NumberFormatException if the limit is present but not numeric
     */
    public Double getLowLimit() {
        return toDouble(lowValue);
    }

    /**
     * @throws NumberFormatException if the limit is present but not numeric
     */
    public Double getHighLimit() {
        return toDouble(highValue);
    }

    private static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : Double.valueOf(text);
    }

    public Boolean getUseCalibrated() {
        return useCalibrated;
    }

    public String getInterpretation() {
        return interpretation;
    }

    @Override
    public String toString() {
        return rawType + "[" + lowValue + ", " + highValue + "]";
    }
}
