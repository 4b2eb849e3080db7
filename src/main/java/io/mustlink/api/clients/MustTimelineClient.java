package io.mustlink.api.clients;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.mustlink.api.model.AlignedSeries;
import io.mustlink.api.model.TimeWindow;
import io.mustlink.api.timeline.Timeline;
import io.mustlink.api.timeline.TimelineSegmenter;

/**
 * Fetches a discrete parameter and segments it into a {@link Timeline}.
 */
public class MustTimelineClient {

    private static final Logger logger = LoggerFactory.getLogger(MustTimelineClient.class);

    private final MustTimeSeriesClient timeSeries;

    public MustTimelineClient(MustTimeSeriesClient timeSeries) {
        this.timeSeries = timeSeries;
    }

    /**
     * @throws EmptyResultException if the parameter has no samples in the window
     */
    public Timeline getTimeline(String parameter, TimeWindow window, String provider, boolean calibrated) {
        AlignedSeries series = timeSeries.getData(List.of(parameter), window, provider, calibrated, null);
        String label = series.getParameters().get(0);
        Timeline timeline = TimelineSegmenter.segment(label, series.getSamples(label), calibrated);
        if (timeline.hasGaps()) {
            logger.info("Timeline of {} contains data gaps", label);
        }
        return timeline;
    }
}
