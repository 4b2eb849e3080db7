package io.mustlink.api.clients;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mustlink.api.model.CatalogNode;
import io.mustlink.api.model.MonitoringCheck;
import io.mustlink.api.model.MonitoringLimits;
import io.mustlink.api.model.ParameterInfo;
import io.mustlink.api.model.Representation;
import io.mustlink.api.model.SearchField;
import io.mustlink.api.util.MustTimeUtils;

/**
 * Client for the MUSTlink parameter metadata endpoints.
 * <p>
 * The service answers a parameter lookup in one of two shapes. SIMPLE records are flat objects
 * ({@code Name}, {@code Description}, {@code First Sample}, ...). COMPLEX records carry the same
 * fields as a {@code metadata} list of key/value pairs next to a {@code monitoringChecks} list.
 * Both are resolved into {@link ParameterInfo} here.
 */
public class MustParametersClient {

    private static final Logger logger = LoggerFactory.getLogger(MustParametersClient.class);

    public static final String PARAMETER_TYPE = "TM";
    public static final String DEFAULT_TREE_FIELDS = "Name,Description";
    static final String TREE_SEARCH_PATH = "/metadata/treesearch";

    private final MustApiBase apiBase;
    private final MustProvidersClient providers;

    public MustParametersClient(MustApiBase apiBase, MustProvidersClient providers) {
        this.apiBase = apiBase;
        this.providers = providers;
    }

    public ParameterInfo getParameterInfo(String parameter, String provider) {
        return getParameterInfo(parameter, provider, Representation.SIMPLE);
    }

    /**
     * Return metadata for a single parameter. COMPLEX mode also extracts monitoring limits.
     *
     * @throws UnknownParameterException if the service knows no such parameter
     */
    public ParameterInfo getParameterInfo(String parameter, String provider, Representation mode) {
        if (mode == null) {
            throw new InvalidArgumentException("mode must be either simple or complex");
        }
        if (parameter == null || parameter.trim().isEmpty()) {
            throw new InvalidArgumentException("parameter name is required");
        }
        String effective = providers.resolve(provider);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("key", "name");
        params.put("value", parameter);
        params.put("search", "false");
        params.put("mode", mode.name());
        params.put("parameterType", PARAMETER_TYPE);

        String url = "/dataproviders/" + effective + "/parameters";
        List<Map<String, Object>> matches = apiBase.parseList(apiBase.get(url, params));
        if (matches.isEmpty()) {
            logger.warn("No matches found for parameter {}", parameter);
            throw new UnknownParameterException("No parameter " + parameter + " for provider " + effective);
        }

        Map<String, Object> record = matches.get(0);
        ParameterInfo info;
        if (mode == Representation.COMPLEX) {
            info = fromComplexRecord(parameter, record);
        } else {
            info = fromSimpleRecord(parameter, record, MonitoringLimits.none());
        }
        logger.info("Parameter info for {} extracted", info.getDescription());
        return info;
    }

    /**
     * Search parameters whose name or description matches {@code text}.
     *
     * @throws EmptyResultException if nothing matches
     */
    public List<ParameterInfo> searchParameters(String text, SearchField searchBy, String provider) {
        if (searchBy == null) {
            throw new InvalidArgumentException("search field must be either description or name");
        }
        String effective = providers.resolve(provider);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("key", searchBy.getServiceKey());
        params.put("value", text != null ? text : "");
        params.put("search", "true");
        params.put("mode", Representation.SIMPLE.name());
        params.put("parameterType", PARAMETER_TYPE);

        String url = "/dataproviders/" + effective + "/parameters";
        List<Map<String, Object>> matches = apiBase.parseList(apiBase.get(url, params));
        if (matches.isEmpty()) {
            logger.warn("No matches found for {}", text);
            throw new EmptyResultException("No parameter " + searchBy.name().toLowerCase(Locale.ROOT) + " matches " + text);
        }

        List<ParameterInfo> results = new ArrayList<>(matches.size());
        for (Map<String, Object> match : matches) {
            results.add(fromSimpleRecord(asString(match.get(ParameterInfo.NAME)), match, MonitoringLimits.none()));
        }
        logger.info("{} parameters match search text: {}", results.size(), text);
        return results;
    }

    public List<ParameterInfo> searchParameters(String text, String searchBy, String provider) {
        return searchParameters(text, SearchField.fromString(searchBy), provider);
    }

    /**
     * Search the metadata tree and return the first node belonging to the resolved provider.
     */
    public Optional<CatalogNode> treeSearch(String text, String fields, String provider) {
        String effective = providers.resolve(provider);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("field", fields != null ? fields : DEFAULT_TREE_FIELDS);
        params.put("text", text != null ? text : "");
        params.put("dataproviders", effective);

        List<Map<String, Object>> nodes = apiBase.parseList(apiBase.get(TREE_SEARCH_PATH, params));
        for (Map<String, Object> node : nodes) {
            Object type = node.get("type");
            if (type != null && type.toString().startsWith(effective)) {
                return Optional.of(new CatalogNode(type.toString(), node));
            }
        }
        logger.debug("No tree node of provider {} matches {}", effective, text);
        return Optional.empty();
    }

    // Record parsing

    @SuppressWarnings("unchecked")
    static ParameterInfo fromComplexRecord(String parameter, Map<String, Object> record) {
        Object metadata = record.get("metadata");
        if (!(metadata instanceof List)) {
            throw new TransportException("Complex parameter record for " + parameter + " carries no metadata");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Object entry : (List<Object>) metadata) {
            if (entry instanceof Map) {
                Map<String, Object> pair = (Map<String, Object>) entry;
                Object key = pair.get("key");
                if (key != null) {
                    fields.put(key.toString(), pair.get("value"));
                }
            }
        }

        List<MonitoringCheck> checks = new ArrayList<>();
        Object rawChecks = record.get("monitoringChecks");
        if (rawChecks instanceof List) {
            for (Object rawCheck : (List<Object>) rawChecks) {
                if (!(rawCheck instanceof Map)) {
                    continue;
                }
                checks.add(MonitoringCheck.fromResponse((Map<String, Object>) rawCheck));
            }
        }
        MonitoringLimits limits;
        try {
            limits = MonitoringLimits.extract(parameter, checks);
        } catch (NumberFormatException e) {
            throw new TransportException("Non-numeric soft or hard limit for " + parameter, e);
        }
        return fromSimpleRecord(parameter, fields, limits);
    }

    static ParameterInfo fromSimpleRecord(String parameter, Map<String, Object> record, MonitoringLimits limits) {
        String name = asString(record.get(ParameterInfo.NAME));
        return new ParameterInfo(
                name != null ? name : parameter,
                asString(record.get(ParameterInfo.DESCRIPTION)),
                asString(record.get(ParameterInfo.UNIT)),
                sampleBound(parameter, ParameterInfo.FIRST_SAMPLE, record),
                sampleBound(parameter, ParameterInfo.LAST_SAMPLE, record),
                limits,
                record);
    }

    private static Instant sampleBound(String parameter, String field, Map<String, Object> record) {
        try {
            return MustTimeUtils.parseSampleBound(record.get(field));
        } catch (DateTimeParseException e) {
            throw new TransportException("Unparsable " + field + " '" + record.get(field) + "' for " + parameter, e);
        }
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
