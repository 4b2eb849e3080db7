package io.mustlink.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Normalized table content: one logical column per header, one map per row.
 * Time columns hold {@link java.time.Instant}s or {@code null} where the cell was not a timestamp.
 */
public class TabularResult {

    private final List<String> headers;
    private final List<Map<String, Object>> rows;
    private final boolean possiblyTruncated;

    public TabularResult(List<String> headers, List<Map<String, Object>> rows, boolean possiblyTruncated) {
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.possiblyTruncated = possiblyTruncated;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    /** True when the service returned exactly as many rows as were requested. */
    public boolean isPossiblyTruncated() {
        return possiblyTruncated;
    }

    public List<Object> getColumn(String header) {
        List<Object> column = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            column.add(row.get(header));
        }
        return column;
    }
}
