package io.mustlink.api.timeline;

import java.time.Duration;
import java.time.Instant;

/**
 * An interval over which a discrete parameter held one value.
 * Gap segments span missing data and carry the value seen before the gap.
 */
public class TimelineSegment {

    private final Instant start;
    private final Instant end;
    private final Object value;
    private final boolean gap;

    public TimelineSegment(Instant start, Instant end, Object value, boolean gap) {
        this.start = start;
        this.end = end;
        this.value = value;
        this.gap = gap;
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Object getValue() {
        return value;
    }

    public boolean isGap() {
        return gap;
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return (gap ? "gap" : "segment") + "[" + start + ", " + end + "]=" + value;
    }
}
