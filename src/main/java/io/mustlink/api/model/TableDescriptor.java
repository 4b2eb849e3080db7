package io.mustlink.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tabular data type published by a provider.
 */
public class TableDescriptor {

    private final String dataType;
    private final String provider;
    private final Map<String, Object> attributes;

    public TableDescriptor(String dataType, String provider, Map<String, Object> attributes) {
        this.dataType = dataType;
        this.provider = provider;
        this.attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Collections.emptyMap();
    }

    public static TableDescriptor fromResponse(Map<String, Object> raw, String provider) {
        Object dataType = raw.get("dataType");
        return new TableDescriptor(dataType != null ? dataType.toString() : null, provider, raw);
    }

    public String getDataType() {
        return dataType;
    }

    public String getProvider() {
        return provider;
    }

    /** Everything else the service returned for the table. */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return provider + "/" + dataType;
    }
}
