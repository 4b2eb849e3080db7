package io.mustlink.api.clients;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.mustlink.api.model.AlignedSeries;
import io.mustlink.api.model.ParameterStatistics;
import io.mustlink.api.model.Sample;
import io.mustlink.api.model.TimeWindow;

public class MustTimeSeriesClientTest extends MustApiTestSupport {

    private static final String DATA_PATH = "/dataproviders/BEPICOLOMBO/parameters/data";
    private static final String PARAMETERS_PATH = "/dataproviders/BEPICOLOMBO/parameters";

    private static final long T0 = 1704067200000L;
    private static final long T1 = T0 + 10_000;
    private static final long T2 = T0 + 20_000;

    private static final TimeWindow WINDOW =
            new TimeWindow(Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T01:00:00Z"));

    private MustTimeSeriesClient timeSeriesClient;

    @BeforeEach
    public void setUp() {
        MustParametersClient parametersClient = new MustParametersClient(apiBase, providers);
        timeSeriesClient = new MustTimeSeriesClient(apiBase, providers, parametersClient, CLOCK);
        pinDefaultProvider();
    }

    private static String series(String name, String points) {
        return "[{\"metadata\":[{\"key\":\"name\",\"value\":\"" + name + "\"},{\"key\":\"unit\",\"value\":\"V\"}],"
                + "\"data\":[" + points + "]}]";
    }

    private static String point(long date, String value, String calibrated) {
        return "{\"date\":" + date + ",\"value\":\"" + value + "\""
                + (calibrated != null ? ",\"calibratedValue\":\"" + calibrated + "\"" : "") + "}";
    }

    @Test
    public void testMultiParameterFetchIsOuterJoinedOnTime() {
        expectGet(DATA_PATH)
                .andExpect(query("key", "name"))
                .andExpect(query("values", "X"))
                .andExpect(query("from", "2024-01-01 00:00:00"))
                .andExpect(query("to", "2024-01-01 01:00:00"))
                .andExpect(query("calibrate", "false"))
                .andExpect(query("chunkCount", ""))
                .andRespond(json(series("X", point(T0, "1", null) + "," + point(T1, "2", null))));
        expectGet(DATA_PATH)
                .andExpect(query("values", "Y"))
                .andRespond(json(series("Y", point(T0, "10", null) + "," + point(T2, "30", null))));

        AlignedSeries aligned = timeSeriesClient.getData(List.of("X", "Y"), WINDOW, null, false, null);

        Instant t0 = Instant.ofEpochMilli(T0);
        Instant t1 = Instant.ofEpochMilli(T1);
        Instant t2 = Instant.ofEpochMilli(T2);
        assertEquals(List.of("X", "Y"), aligned.getParameters());
        assertEquals(List.of(t0, t1, t2), aligned.getTimestamps());
        assertEquals("1", aligned.getValue("X", t0));
        assertEquals("10", aligned.getValue("Y", t0));
        assertNull(aligned.getSample("X", t2));
        assertNull(aligned.getSample("Y", t1));
        assertFalse(aligned.toValueTable().get(t1).containsKey("Y"));
        server.verify();
    }

    @Test
    public void testEmptyParameterIsSkippedWhenOthersHaveData() {
        expectGet(DATA_PATH).andExpect(query("values", "X")).andRespond(json(series("X", "")));
        expectGet(DATA_PATH).andExpect(query("values", "Y")).andRespond(json(series("Y", point(T0, "10", null))));

        AlignedSeries aligned = timeSeriesClient.getData(List.of("X", "Y"), WINDOW, PROVIDER, false, null);

        assertEquals(List.of("Y"), aligned.getParameters());
        assertEquals(1, aligned.size());
        server.verify();
    }

    @Test
    public void testRepeatedParameterIsFetchedOnce() {
        expectGet(DATA_PATH).andExpect(query("values", "X")).andRespond(json(series("X", point(T0, "1", null))));

        AlignedSeries aligned = timeSeriesClient.getData(List.of("X", "X"), WINDOW, PROVIDER, false, null);

        assertEquals(List.of("X"), aligned.getParameters());
        assertEquals(1, aligned.size());
        server.verify();
    }

    @Test
    public void testTwoNamesReportedAsOneParameterIsTransportFailure() {
        expectGet(DATA_PATH).andExpect(query("values", "X")).andRespond(json(series("X", point(T0, "1", null))));
        expectGet(DATA_PATH).andExpect(query("values", "x")).andRespond(json(series("X", point(T1, "2", null))));

        assertThrows(TransportException.class,
                () -> timeSeriesClient.getData(List.of("X", "x"), WINDOW, PROVIDER, false, null));
        server.verify();
    }

    @Test
    public void testSingleEmptyParameterIsEmptyResult() {
        expectGet(DATA_PATH).andRespond(json(series("X", "")));

        assertThrows(EmptyResultException.class, () -> timeSeriesClient.getData("X", WINDOW, PROVIDER));
        server.verify();
    }

    @Test
    public void testDefaultWindowIsLastDay() {
        expectGet(DATA_PATH)
                .andExpect(query("from", "2024-03-01 12:00:00"))
                .andExpect(query("to", "2024-03-02 12:00:00"))
                .andExpect(query("chunkCount", "500"))
                .andRespond(json(series("X", point(T0, "1", null))));

        timeSeriesClient.getData(List.of("X"), null, PROVIDER, false, 500);
        server.verify();
    }

    @Test
    public void testUncalibratedFetchDropsCalibratedValues() {
        expectGet(DATA_PATH).andRespond(json(series("X", point(T0, "1", "1.5"))));

        AlignedSeries aligned = timeSeriesClient.getData("X", WINDOW, PROVIDER);

        Sample sample = aligned.getSample("X", Instant.ofEpochMilli(T0));
        assertNull(sample.getCalibratedValue());
        assertFalse(sample.hasCalibratedValue());
        assertEquals("1", aligned.getValue("X", Instant.ofEpochMilli(T0)));
        server.verify();
    }

    @Test
    public void testCalibratedFetchKeepsCalibratedValues() {
        expectGet(DATA_PATH)
                .andExpect(query("calibrate", "true"))
                .andRespond(json(series("X", point(T0, "1", "1.5"))));

        AlignedSeries aligned = timeSeriesClient.getData(List.of("X"), WINDOW, PROVIDER, true, null);

        assertTrue(aligned.isCalibrated());
        assertEquals("1.5", aligned.getValue("X", Instant.ofEpochMilli(T0)));
        assertEquals("1", aligned.getSample("X", Instant.ofEpochMilli(T0)).getRawValue());
        server.verify();
    }

    @Test
    public void testInvalidArgumentsFailLocally() {
        assertThrows(InvalidArgumentException.class,
                () -> timeSeriesClient.getData(List.of(), WINDOW, PROVIDER, false, null));
        assertThrows(InvalidArgumentException.class,
                () -> timeSeriesClient.getData(List.of("X"), WINDOW, PROVIDER, false, 0));
        assertThrows(UnknownProviderException.class,
                () -> timeSeriesClient.getData(List.of("X"), WINDOW, "VENUS", false, null));
        server.verify();
    }

    @Test
    public void testLatestFetchesOneSecondFromLastSample() {
        expectGet(PARAMETERS_PATH)
                .andExpect(query("value", "X"))
                .andRespond(json("[{\"Name\":\"X\",\"First Sample\":\"2023-01-01 00:00:00\","
                        + "\"Last Sample\":\"2024-01-01 00:00:10\"}]"));
        expectGet(DATA_PATH)
                .andExpect(query("from", "2024-01-01 00:00:10"))
                .andExpect(query("to", "2024-01-01 00:00:11"))
                .andRespond(json(series("X", point(T1, "2", null) + "," + point(T1 + 500, "3", null))));

        Sample latest = timeSeriesClient.getLatestValue("X", PROVIDER, false);

        assertEquals(Instant.ofEpochMilli(T1 + 500), latest.getTimestamp());
        assertEquals("3", latest.getRawValue());
        server.verify();
    }

    @Test
    public void testLatestWithoutRecordedSamples() {
        expectGet(PARAMETERS_PATH).andRespond(json("[{\"Name\":\"X\",\"Last Sample\":\"N/A\"}]"));

        assertThrows(EmptyResultException.class, () -> timeSeriesClient.getLatestValue("X", PROVIDER, false));
        server.verify();
    }

    @Test
    public void testLatestWithStaleLastSamplePointer() {
        expectGet(PARAMETERS_PATH).andRespond(json("[{\"Name\":\"X\",\"Last Sample\":\"2024-01-01 00:00:10\"}]"));
        expectGet(DATA_PATH).andRespond(json("[]"));

        assertThrows(EmptyResultException.class, () -> timeSeriesClient.getLatestValue("X", PROVIDER, false));
        server.verify();
    }

    @Test
    public void testStatisticsNormalizesTimestamps() {
        expectGet("/dataproviders/BEPICOLOMBO/parameters/statistics")
                .andExpect(query("key", "name"))
                .andExpect(query("values", "X"))
                .andExpect(query("from", "2024-01-01 00:00:00"))
                .andRespond(json("{\"parameter\":\"X\",\"from\":\"2024-01-01 00:00:00\",\"to\":" + T2 + ","
                        + "\"min\":1,\"max\":3.5,\"count\":12}"));

        ParameterStatistics stats = timeSeriesClient.getStatistics("X", WINDOW, PROVIDER);

        assertEquals("X", stats.getParameter());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), stats.getFrom());
        assertEquals(Instant.ofEpochMilli(T2), stats.getTo());
        assertEquals(3.5, stats.getDouble("max"));
        assertEquals(12, stats.getValues().get("count"));
        assertFalse(stats.getValues().containsKey("from"));
        server.verify();
    }
}
