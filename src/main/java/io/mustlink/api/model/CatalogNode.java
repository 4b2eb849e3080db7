package io.mustlink.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the hierarchical metadata catalog returned by a tree search.
 */
public class CatalogNode {

    private final String type;
    private final Map<String, Object> attributes;

    public CatalogNode(String type, Map<String, Object> attributes) {
        this.type = type;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object get(String key) {
        return attributes.get(key);
    }
}
