package io.mustlink.api.timeline;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mustlink.api.model.Sample;

/**
 * Turns the samples of a discrete-valued parameter into contiguous value segments.
 * <p>
 * A new segment starts wherever the value differs from the previous sample. The nominal
 * sampling interval is the mean spacing over the whole series; an interval between two
 * consecutive samples strictly longer than twice that mean is reported as a gap segment
 * carrying the value seen before it.
 */
public final class TimelineSegmenter {

    private static final Logger logger = LoggerFactory.getLogger(TimelineSegmenter.class);

    private TimelineSegmenter() {
    }

    public static Timeline segment(String parameter, List<Sample> samples, boolean calibrated) {
        List<Sample> ordered = new ArrayList<>(samples);
        ordered.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));

        List<TimelineSegment> segments = new ArrayList<>();
        if (ordered.isEmpty()) {
            return new Timeline(parameter, segments, null, Map.of());
        }

        int count = ordered.size();
        Instant first = ordered.get(0).getTimestamp();
        Instant last = ordered.get(count - 1).getTimestamp();
        Duration span = Duration.between(first, last);
        Duration nominal = count > 1 ? span.dividedBy(count - 1) : null;

        Instant segmentStart = first;
        Object current = ordered.get(0).getValue(calibrated);
        for (int i = 0; i + 1 < count; i++) {
            Instant from = ordered.get(i).getTimestamp();
            Instant to = ordered.get(i + 1).getTimestamp();
            if (isGap(Duration.between(from, to), span, count)) {
                addSegment(segments, segmentStart, from, current, false);
                addSegment(segments, from, to, current, true);
                segmentStart = to;
            }
            Object next = ordered.get(i + 1).getValue(calibrated);
            if (!Objects.equals(current, next)) {
                addSegment(segments, segmentStart, to, current, false);
                segmentStart = to;
                current = next;
            }
        }
        addSegment(segments, segmentStart, last, current, false);
        if (segments.isEmpty()) {
            // every sample shares one timestamp
            segments.add(new TimelineSegment(first, last, current, false));
        }

        logger.debug("{} samples of {} segmented into {} segment(s), nominal interval {}",
                count, parameter, segments.size(), nominal);
        return new Timeline(parameter, segments, nominal, labelIndex(ordered, calibrated));
    }

    /**
     * Compares {@code interval > 2 * span / (count - 1)} without rounding the mean.
     */
    static boolean isGap(Duration interval, Duration span, int count) {
        return interval.multipliedBy(count - 1L).compareTo(span.multipliedBy(2)) > 0;
    }

    private static void addSegment(List<TimelineSegment> segments, Instant start, Instant end, Object value,
            boolean gap) {
        if (end.isAfter(start)) {
            segments.add(new TimelineSegment(start, end, value, gap));
        }
    }

    static Map<String, Integer> labelIndex(List<Sample> samples, boolean calibrated) {
        TreeSet<String> distinct = new TreeSet<>();
        for (Sample sample : samples) {
            distinct.add(String.valueOf(sample.getValue(calibrated)));
        }
        Map<String, Integer> labels = new LinkedHashMap<>();
        for (String value : distinct) {
            labels.put(value, labels.size());
        }
        return labels;
    }
}
