package io.mustlink.api.clients;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mustlink.api.model.AlignedSeries;
import io.mustlink.api.model.ParameterInfo;
import io.mustlink.api.model.ParameterStatistics;
import io.mustlink.api.model.Sample;
import io.mustlink.api.model.TimeWindow;
import io.mustlink.api.util.MustTimeUtils;

/**
 * Client for the MUSTlink parameter data and statistics endpoints.
 * Multi-parameter requests are issued one parameter at a time, in order, and merged on timestamp.
 */
public class MustTimeSeriesClient {

    private static final Logger logger = LoggerFactory.getLogger(MustTimeSeriesClient.class);

    static final Duration LATEST_WINDOW = Duration.ofSeconds(1);

    private final MustApiBase apiBase;
    private final MustProvidersClient providers;
    private final MustParametersClient parameters;
    private final Clock clock;

    public MustTimeSeriesClient(MustApiBase apiBase, MustProvidersClient providers, MustParametersClient parameters) {
        this(apiBase, providers, parameters, Clock.systemUTC());
    }

    public MustTimeSeriesClient(MustApiBase apiBase, MustProvidersClient providers, MustParametersClient parameters,
            Clock clock) {
        this.apiBase = apiBase;
        this.providers = providers;
        this.parameters = parameters;
        this.clock = clock;
    }

    public AlignedSeries getData(String parameter, TimeWindow window, String provider) {
        return getData(List.of(parameter), window, provider, false, null);
    }

    /**
     * Retrieve one or more parameters over a window and align them on a common time axis.
     * Parameters without samples in the window are skipped; repeated names are fetched once.
     *
     * @param window request window, or {@code null} for the last 24 hours
     * @param calibrated whether calibrated values are requested; when false they are dropped from the result
     * @param maxPoints optional cap the service applies per parameter
     * @throws EmptyResultException if none of the parameters has samples in the window
     */
    public AlignedSeries getData(List<String> parameterNames, TimeWindow window, String provider,
            boolean calibrated, Integer maxPoints) {
        if (parameterNames == null || parameterNames.isEmpty()) {
            throw new InvalidArgumentException("at least one parameter name is required");
        }
        if (maxPoints != null && maxPoints <= 0) {
            throw new InvalidArgumentException("maxPoints must be positive: " + maxPoints);
        }
        String effective = providers.resolve(provider);
        TimeWindow effectiveWindow = window != null ? window : TimeWindow.lastDay(clock);

        Set<String> uniqueNames = new LinkedHashSet<>(parameterNames);
        if (uniqueNames.size() < parameterNames.size()) {
            logger.debug("Duplicate parameter names ignored: {}", parameterNames);
        }

        AlignedSeries series = new AlignedSeries(calibrated);
        for (String parameter : uniqueNames) {
            SeriesResponse response = fetchSeries(effective, parameter, effectiveWindow, calibrated, maxPoints);
            if (response.samples.isEmpty()) {
                logger.warn("No data available for parameter {} in {}", parameter, effectiveWindow);
                continue;
            }
            if (series.getParameters().contains(response.name)) {
                throw new TransportException("Parameter " + parameter + " reported as " + response.name
                        + ", which was already retrieved");
            }
            series.addParameter(response.name, response.samples);
            logger.info("{} values retrieved for parameter {}", response.samples.size(), parameter);
        }

        if (series.getParameters().isEmpty()) {
            logger.warn("No data found for any parameter");
            throw new EmptyResultException("No data for " + String.join(", ", parameterNames)
                    + " in " + effectiveWindow);
        }
        return series;
    }

    /**
     * Retrieve the most recent sample of a parameter, located through its last-sample timestamp.
     *
     * @throws EmptyResultException if the parameter never recorded a sample, or the service's
     *         last-sample pointer does not lead to any data
     */
    public Sample getLatestValue(String parameter, String provider, boolean calibrated) {
        String effective = providers.resolve(provider);
        ParameterInfo info = parameters.getParameterInfo(parameter, effective);
        Instant lastSample = info.getLastSample();
        if (lastSample == null) {
            throw new EmptyResultException("Parameter " + parameter + " has no recorded samples");
        }

        TimeWindow window = new TimeWindow(lastSample, lastSample.plus(LATEST_WINDOW));
        SeriesResponse response = fetchSeries(effective, parameter, window, calibrated, null);
        if (response.samples.isEmpty()) {
            logger.warn("No data available for parameter {} at its last sample time {}", parameter, lastSample);
            throw new EmptyResultException("No data for " + parameter + " at reported last sample " + lastSample);
        }
        Sample latest = response.samples.get(response.samples.size() - 1);
        logger.info("Value retrieved at time {}", MustTimeUtils.formatRequestTime(latest.getTimestamp()));
        return latest;
    }

    /**
     * Retrieve the service-side statistics of a parameter over a window.
     */
    public ParameterStatistics getStatistics(String parameter, TimeWindow window, String provider) {
        String effective = providers.resolve(provider);
        TimeWindow effectiveWindow = window != null ? window : TimeWindow.lastDay(clock);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("key", "name");
        params.put("values", parameter);
        params.put("from", MustTimeUtils.formatRequestTime(effectiveWindow.getStart()));
        params.put("to", MustTimeUtils.formatRequestTime(effectiveWindow.getEnd()));

        String url = "/dataproviders/" + effective + "/parameters/statistics";
        Map<String, Object> response = apiBase.parseMap(apiBase.get(url, params));
        if (response.isEmpty()) {
            throw new EmptyResultException("No statistics for " + parameter + " in " + effectiveWindow);
        }

        Map<String, Object> values = new LinkedHashMap<>(response);
        Object name = values.remove("parameter");
        Instant from = toInstant(values.remove("from"), "from");
        Instant to = toInstant(values.remove("to"), "to");

        ParameterStatistics statistics = new ParameterStatistics(
                name != null ? name.toString() : parameter, from, to, values);
        logger.info("Parameter statistics for {} extracted", statistics.getParameter());
        return statistics;
    }

    // Response handling

    private SeriesResponse fetchSeries(String provider, String parameter, TimeWindow window,
            boolean calibrated, Integer maxPoints) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("key", "name");
        params.put("values", parameter);
        params.put("from", MustTimeUtils.formatRequestTime(window.getStart()));
        params.put("to", MustTimeUtils.formatRequestTime(window.getEnd()));
        params.put("calibrate", calibrated ? "true" : "false");
        params.put("chunkCount", maxPoints != null ? maxPoints.toString() : "");

        String url = "/dataproviders/" + provider + "/parameters/data";
        List<Map<String, Object>> response = apiBase.parseList(apiBase.get(url, params));
        if (response.isEmpty()) {
            return new SeriesResponse(parameter, List.of());
        }
        return parseSeries(parameter, response.get(0), calibrated);
    }

    @SuppressWarnings("unchecked")
    static SeriesResponse parseSeries(String parameter, Map<String, Object> entry, boolean calibrated) {
        String name = parameter;
        Object metadata = entry.get("metadata");
        if (metadata instanceof List) {
            for (Object item : (List<Object>) metadata) {
                if (item instanceof Map && "name".equals(((Map<String, Object>) item).get("key"))) {
                    Object value = ((Map<String, Object>) item).get("value");
                    if (value != null) {
                        name = value.toString();
                    }
                }
            }
        }

        List<Sample> samples = new ArrayList<>();
        Object data = entry.get("data");
        if (data instanceof List) {
            for (Object item : (List<Object>) data) {
                if (!(item instanceof Map)) {
                    throw new TransportException("Malformed sample for " + parameter + ": " + item);
                }
                Map<String, Object> point = (Map<String, Object>) item;
                Instant timestamp;
                try {
                    timestamp = MustTimeUtils.fromEpochMillis(point.get("date"));
                } catch (DateTimeParseException e) {
                    throw new TransportException("Malformed sample date for " + parameter + ": " + point.get("date"), e);
                }
                Object calibratedValue = calibrated ? point.get("calibratedValue") : null;
                samples.add(new Sample(timestamp, point.get("value"), calibratedValue));
            }
        }
        samples.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
        return new SeriesResponse(name, samples);
    }

    private static Instant toInstant(Object value, String field) {
        if (value == null) {
            return null;
        }
        try {
            return MustTimeUtils.fromEpochMillis(value);
        } catch (DateTimeParseException e) {
            throw new TransportException("Unparsable statistics " + field + ": " + value, e);
        }
    }

    static final class SeriesResponse {
        final String name;
        final List<Sample> samples;

        SeriesResponse(String name, List<Sample> samples) {
            this.name = name;
            this.samples = samples;
        }
    }
}
