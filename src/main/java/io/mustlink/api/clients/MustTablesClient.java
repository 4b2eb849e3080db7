package io.mustlink.api.clients;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mustlink.api.model.Representation;
import io.mustlink.api.model.TableDescriptor;
import io.mustlink.api.model.TableMode;
import io.mustlink.api.model.TabularResult;
import io.mustlink.api.model.TimeWindow;
import io.mustlink.api.util.MustTimeUtils;

/**
 * Client for the MUSTlink table endpoints.
 * The table list of each provider is fetched lazily and cached for the lifetime of the client
 * unless {@link #refreshTables(String)} is called.
 */
public class MustTablesClient {

    private static final Logger logger = LoggerFactory.getLogger(MustTablesClient.class);

    public static final int DEFAULT_MAX_ROWS = 1000;
    public static final String DEFAULT_FILTER_KEY = "name";
    public static final String TIME_QUALITY_COLUMN = "Time Quality";

    // Presentation fields of a table-parameter cell
    private static final Set<String> CELL_DISPLAY_FIELDS =
            Set.of("cellValue", "altText", "bgColor", "detail", "webpagelink", "rowParams");

    private final MustApiBase apiBase;
    private final MustProvidersClient providers;
    private final Clock clock;
    private final Map<String, List<TableDescriptor>> tables = new HashMap<>();

    public MustTablesClient(MustApiBase apiBase, MustProvidersClient providers) {
        this(apiBase, providers, Clock.systemUTC());
    }

    public MustTablesClient(MustApiBase apiBase, MustProvidersClient providers, Clock clock) {
        this.apiBase = apiBase;
        this.providers = providers;
        this.clock = clock;
    }

    /**
     * Get the tables published by a provider, from the cache when already loaded.
     */
    public List<TableDescriptor> listTables(String provider) {
        String effective = providers.resolve(provider);
        List<TableDescriptor> cached = tables.get(effective);
        if (cached != null) {
            return cached;
        }

        String url = "/dataproviders/" + effective + "/tables";
        List<Map<String, Object>> entries = apiBase.parseList(apiBase.get(url, Map.of()));
        List<TableDescriptor> descriptors = new ArrayList<>(entries.size());
        for (Map<String, Object> entry : entries) {
            descriptors.add(TableDescriptor.fromResponse(entry, effective));
        }
        descriptors = Collections.unmodifiableList(descriptors);
        tables.put(effective, descriptors);
        logger.info("Provider {} has {} table(s)", effective, descriptors.size());
        return descriptors;
    }

    /**
     * Drop the cached table list of a provider; the next lookup fetches it again.
     */
    public void refreshTables(String provider) {
        String effective = providers.resolve(provider);
        tables.remove(effective);
        logger.debug("Table cache cleared for provider {}", effective);
    }

    public boolean hasTable(String provider, String table) {
        return listTables(provider).stream().anyMatch(t -> t.getDataType() != null && t.getDataType().equals(table));
    }

    private String requireTable(String provider, String table) {
        String effective = providers.resolve(provider);
        if (!hasTable(effective, table)) {
            logger.error("Table {} invalid for provider {}", table, effective);
            throw new UnknownTableException("Table " + table + " invalid for provider " + effective);
        }
        return effective;
    }

    /**
     * Get the metadata associated with a table.
     */
    public Map<String, Object> getTableMetadata(String table, String provider) {
        String effective = requireTable(provider, table);
        String url = "/dataproviders/" + effective + "/table/" + table + "/metadata";
        return apiBase.parseMap(apiBase.get(url, Map.of()));
    }

    public TabularResult getTableData(String table, TimeWindow window, String provider) {
        return getTableData(table, window, DEFAULT_FILTER_KEY, "", provider, DEFAULT_MAX_ROWS,
                TableMode.BRIEF, Representation.COMPLEX);
    }

    /**
     * Retrieve table rows over a time window, filtered on {@code filterKey} matching {@code filterText}.
     * Columns with "time" in the header (other than "Time Quality") are converted to instants;
     * cells that do not parse become {@code null}.
     *
     * @param window request window, or {@code null} for the last 24 hours
     * @throws EmptyResultException if the service returned no rows
     */
    public TabularResult getTableData(String table, TimeWindow window, String filterKey, String filterText,
            String provider, int maxRows, TableMode mode, Representation representation) {
        if (maxRows <= 0) {
            throw new InvalidArgumentException("maxRows must be positive: " + maxRows);
        }
        if (mode == null || representation == null) {
            throw new InvalidArgumentException("mode and representation are required");
        }
        String effective = requireTable(provider, table);
        TimeWindow effectiveWindow = window != null ? window : TimeWindow.lastDay(clock);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("dateFormat", "fromTo");
        params.put("from", MustTimeUtils.formatRequestTime(effectiveWindow.getStart()));
        params.put("to", MustTimeUtils.formatRequestTime(effectiveWindow.getEnd()));
        params.put("filterKeys", filterKey != null ? filterKey : DEFAULT_FILTER_KEY);
        params.put("filterValues", filterText != null ? filterText : "");
        params.put("mode", mode.name());
        params.put("representation", representation.name());
        params.put("maxRows", maxRows);

        String url = "/dataproviders/" + effective + "/table/" + table + "/data";
        Map<String, Object> response = apiBase.parseMap(apiBase.get(url, params));
        logger.debug("Data retrieval done for table {}", table);

        List<String> headers = readHeaders(response);
        List<?> data = readData(response);
        if (data.isEmpty()) {
            logger.warn("No table data found for table {} in {}", table, effectiveWindow);
            throw new EmptyResultException("No data in table " + table + " for " + effectiveWindow);
        }

        List<Map<String, Object>> rows = representation == Representation.COMPLEX
                ? normalizeComplexRows(headers, data)
                : normalizeSimpleRows(headers, data);
        convertTimeColumns(headers, rows);

        boolean truncated = rows.size() == maxRows;
        logger.info("{} table entries retrieved", rows.size());
        if (truncated) {
            logger.warn("Number of rows returned equal to maximum ({}) - increase maxRows for more data", maxRows);
        }
        return new TabularResult(headers, rows, truncated);
    }

    /**
     * Retrieve the table parameters of {@code parameter} at a given time.
     * Each data cell of the returned row becomes one result row.
     *
     * @throws EmptyResultException if the service returned no data
     */
    @SuppressWarnings("unchecked")
    public TabularResult getTableParameters(String table, String parameter, Instant timestamp, String provider) {
        if (timestamp == null) {
            throw new InvalidArgumentException("timestamp is required");
        }
        String effective = requireTable(provider, table);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("elementId", parameter);
        params.put("ssc", "null");
        params.put("timestamp", MustTimeUtils.formatRequestTimeMillis(timestamp));

        String url = "/web/tables/params/" + effective + "/" + table;
        Map<String, Object> response = apiBase.parseMap(apiBase.get(url, params));

        List<String> headers = readHeaders(response);
        List<?> data = readData(response);
        if (data.isEmpty()) {
            logger.warn("No data found for parameter {} at {}", parameter, timestamp);
            throw new EmptyResultException("No table parameters for " + parameter + " at " + timestamp);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Object cellObj : readCells(data.get(0))) {
            Map<String, Object> cell = (Map<String, Object>) cellObj;
            Map<String, Object> row = new LinkedHashMap<>();
            int column = 0;
            for (Map.Entry<String, Object> field : cell.entrySet()) {
                if (CELL_DISPLAY_FIELDS.contains(field.getKey())) {
                    continue;
                }
                String header = column < headers.size() ? headers.get(column) : field.getKey();
                row.put(header, field.getValue());
                column++;
            }
            rows.add(row);
        }
        logger.debug("{} table parameter entries retrieved", rows.size());
        return new TabularResult(headers, rows, false);
    }

    /**
     * Get the aggregations defined for a provider, optionally restricted to one id.
     */
    public List<Map<String, Object>> getAggregations(String provider, String id) {
        String effective = providers.resolve(provider);
        Map<String, Object> params = new LinkedHashMap<>();
        if (id != null) {
            params.put("key", "id");
            params.put("value", id);
        }
        String url = "/dataproviders/" + effective + "/aggregations";
        return apiBase.parseList(apiBase.get(url, params));
    }

    // Row normalization

    @SuppressWarnings("unchecked")
    private static List<String> readHeaders(Map<String, Object> response) {
        Object headers = response.get("headers");
        if (!(headers instanceof List)) {
            throw new TransportException("Table response carries no headers");
        }
        List<String> names = new ArrayList<>();
        for (Object header : (List<Object>) headers) {
            names.add(String.valueOf(header));
        }
        return names;
    }

    private static List<?> readData(Map<String, Object> response) {
        Object data = response.get("data");
        if (data == null) {
            return List.of();
        }
        if (!(data instanceof List)) {
            throw new TransportException("Table response data is not a list");
        }
        return (List<?>) data;
    }

    @SuppressWarnings("unchecked")
    private static List<?> readCells(Object row) {
        if (!(row instanceof Map) || !(((Map<String, Object>) row).get("dataCells") instanceof List)) {
            throw new TransportException("Complex table row carries no dataCells");
        }
        return (List<?>) ((Map<String, Object>) row).get("dataCells");
    }

    /**
     * Complex rows wrap each value in a cell object; cells are matched to headers by position.
     */
    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> normalizeComplexRows(List<String> headers, List<?> data) {
        List<Map<String, Object>> rows = new ArrayList<>(data.size());
        for (Object rowObj : data) {
            List<?> cells = readCells(rowObj);
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                Object value = null;
                if (i < cells.size() && cells.get(i) instanceof Map) {
                    value = ((Map<String, Object>) cells.get(i)).get("cellValue");
                }
                row.put(headers.get(i), value);
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Simple rows are flat objects keyed by header.
     */
    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> normalizeSimpleRows(List<String> headers, List<?> data) {
        List<Map<String, Object>> rows = new ArrayList<>(data.size());
        for (Object rowObj : data) {
            if (!(rowObj instanceof Map)) {
                throw new TransportException("Simple table row is not an object");
            }
            Map<String, Object> raw = (Map<String, Object>) rowObj;
            Map<String, Object> row = new LinkedHashMap<>();
            for (String header : headers) {
                row.put(header, raw.get(header));
            }
            rows.add(row);
        }
        return rows;
    }

    static boolean isTimeColumn(String header) {
        return header != null
                && header.toLowerCase(Locale.ROOT).contains("time")
                && !TIME_QUALITY_COLUMN.equals(header);
    }

    private static void convertTimeColumns(List<String> headers, List<Map<String, Object>> rows) {
        for (String header : headers) {
            if (!isTimeColumn(header)) {
                continue;
            }
            for (Map<String, Object> row : rows) {
                row.put(header, MustTimeUtils.parseOrNull(row.get(header)));
            }
        }
    }
}
