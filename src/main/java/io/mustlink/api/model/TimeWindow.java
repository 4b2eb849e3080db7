package io.mustlink.api.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

import io.mustlink.api.clients.InvalidArgumentException;
import io.mustlink.api.util.MustTimeUtils;

/**
 * Closed request window {@code [start, end]}.
 */
public class TimeWindow {

    public static final Duration DEFAULT_SPAN = Duration.ofDays(1);

    private final Instant start;
    private final Instant end;

    public TimeWindow(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new InvalidArgumentException("window start and end are required");
        }
        if (end.isBefore(start)) {
            throw new InvalidArgumentException("window end " + end + " is before start " + start);
        }
        this.start = start;
        this.end = end;
    }

    /** The 24 hours up to now, evaluated against the given clock. */
    public static TimeWindow lastDay(Clock clock) {
        Instant now = clock.instant();
        return new TimeWindow(now.minus(DEFAULT_SPAN), now);
    }

    /**
     * Window from optional bounds: a missing start defaults to 24 hours ago,
     * a missing end defaults to now.
     */
    public static TimeWindow of(Instant start, Instant end, Clock clock) {
        Instant effectiveEnd = end != null ? end : clock.instant();
        Instant effectiveStart = start != null ? start : clock.instant().minus(DEFAULT_SPAN);
        return new TimeWindow(effectiveStart, effectiveEnd);
    }

    public static TimeWindow parse(String start, String end, Clock clock) {
        try {
            return of(start != null ? MustTimeUtils.parseTimestamp(start) : null,
                    end != null ? MustTimeUtils.parseTimestamp(end) : null, clock);
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException("unparsable window bound: " + e.getParsedString());
        }
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration getDuration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return MustTimeUtils.formatRequestTime(start) + " - " + MustTimeUtils.formatRequestTime(end);
    }
}
