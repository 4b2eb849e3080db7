package io.mustlink.api.timeline;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Segmented view of one discrete parameter.
 */
public class Timeline {

    private final String parameter;
    private final List<TimelineSegment> segments;
    private final Duration nominalInterval;
    private final Map<String, Integer> labels;

    public Timeline(String parameter, List<TimelineSegment> segments, Duration nominalInterval,
            Map<String, Integer> labels) {
        this.parameter = parameter;
        this.segments = Collections.unmodifiableList(segments);
        this.nominalInterval = nominalInterval;
        this.labels = Collections.unmodifiableMap(labels);
    }

    public String getParameter() {
        return parameter;
    }

    /** All segments in time order, gap segments included. */
    public List<TimelineSegment> getSegments() {
        return segments;
    }

    /** Segments to render, i.e. without the gap segments. */
    public List<TimelineSegment> getValueSegments() {
        return segments.stream().filter(s -> !s.isGap()).collect(Collectors.toList());
    }

    public boolean hasGaps() {
        return segments.stream().anyMatch(TimelineSegment::isGap);
    }

    /** Mean spacing of the samples, or {@code null} with fewer than two samples. */
    public Duration getNominalInterval() {
        return nominalInterval;
    }

    /** Stable index per distinct value, independent of segment order. */
    public Map<String, Integer> getLabels() {
        return labels;
    }

    public Integer getLabel(Object value) {
        return labels.get(String.valueOf(value));
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }
}
