package io.mustlink.api.clients;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.mustlink.api.model.CatalogNode;
import io.mustlink.api.model.ParameterInfo;
import io.mustlink.api.model.Representation;
import io.mustlink.api.model.SearchField;

public class MustParametersClientTest extends MustApiTestSupport {

    private static final String PARAMETERS_PATH = "/dataproviders/BEPICOLOMBO/parameters";

    private MustParametersClient parametersClient;

    @BeforeEach
    public void setUp() {
        parametersClient = new MustParametersClient(apiBase, providers);
        pinDefaultProvider();
    }

    private static String check(String type, Object low, Object high, boolean calibrated, String interpretation) {
        return "{\"useCalibrated\":" + calibrated + ",\"checkInterpretation\":\"" + interpretation + "\","
                + "\"checkDefinitions\":{\"type\":\"" + type + "\",\"lowValue\":" + low + ",\"highValue\":" + high + "}}";
    }

    private static String complexRecord(String... checks) {
        return "{\"metadata\":["
                + "{\"key\":\"Name\",\"value\":\"NCADAF41\"},"
                + "{\"key\":\"Description\",\"value\":\"Tank temperature\"},"
                + "{\"key\":\"Unit\",\"value\":\"degC\"},"
                + "{\"key\":\"First Sample\",\"value\":\"2024-01-01 00:00:00\"},"
                + "{\"key\":\"Last Sample\",\"value\":\"N/A\"}],"
                + "\"monitoringChecks\":[" + String.join(",", checks) + "]}";
    }

    @Test
    public void testSimpleInfoMapsSentinelToAbsent() {
        expectGet(PARAMETERS_PATH)
                .andExpect(query("key", "name"))
                .andExpect(query("value", "NCADAF41"))
                .andExpect(query("search", "false"))
                .andExpect(query("mode", "SIMPLE"))
                .andExpect(query("parameterType", "TM"))
                .andRespond(json("[{\"Name\":\"NCADAF41\",\"Description\":\"Tank temperature\",\"Unit\":\"degC\","
                        + "\"First Sample\":\"N/A\",\"Last Sample\":\"2024-02-01 10:00:00\"}]"));

        ParameterInfo info = parametersClient.getParameterInfo("NCADAF41", null);

        assertEquals("NCADAF41", info.getName());
        assertEquals("Tank temperature", info.getDescription());
        assertEquals("degC", info.getUnit());
        assertNull(info.getFirstSample());
        assertEquals(Instant.parse("2024-02-01T10:00:00Z"), info.getLastSample());
        assertFalse(info.getLimits().hasLimits());
        server.verify();
    }

    @Test
    public void testComplexInfoExtractsSoftAndHardLimits() {
        expectGet(PARAMETERS_PATH)
                .andExpect(query("mode", "COMPLEX"))
                .andRespond(json(complexRecord(
                        check("SOFT", 1, 9, true, "ENGINEERING"),
                        check("HARD", 0, 10, true, "ENGINEERING"))));

        ParameterInfo info = parametersClient.getParameterInfo("NCADAF41", PROVIDER, Representation.COMPLEX);

        assertEquals(1.0, info.getSoftLow());
        assertEquals(9.0, info.getSoftHigh());
        assertEquals(0.0, info.getHardLow());
        assertEquals(10.0, info.getHardHigh());
        assertEquals(Boolean.TRUE, info.getCheckCalibrated());
        assertEquals("ENGINEERING", info.getCheckInterpretation());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), info.getFirstSample());
        assertNull(info.getLastSample());
        server.verify();
    }

    @Test
    public void testThreeChecksDegradeToNoLimits() {
        expectGet(PARAMETERS_PATH).andRespond(json(complexRecord(
                check("SOFT", 1, 9, true, "ENGINEERING"),
                check("HARD", 0, 10, true, "ENGINEERING"),
                check("SOFT", 2, 8, true, "ENGINEERING"))));

        ParameterInfo info = parametersClient.getParameterInfo("NCADAF41", PROVIDER, Representation.COMPLEX);

        assertFalse(info.getLimits().hasLimits());
        assertNull(info.getSoftLow());
        assertNull(info.getHardHigh());
        assertEquals(3, info.getLimits().getCheckCount());
        assertEquals("Tank temperature", info.getDescription());
        server.verify();
    }

    @Test
    public void testThreeChecksWithStatusLimitsDegradeToNoLimits() {
        expectGet(PARAMETERS_PATH).andRespond(json(complexRecord(
                check("SOFT", 1, 9, true, "ENGINEERING"),
                check("HARD", 0, 10, true, "ENGINEERING"),
                check("STATUS", "\"ON\"", "\"ON\"", true, "ENGINEERING"))));

        ParameterInfo info = parametersClient.getParameterInfo("NCADAF41", PROVIDER, Representation.COMPLEX);

        assertFalse(info.getLimits().hasLimits());
        assertEquals(3, info.getLimits().getCheckCount());
        server.verify();
    }

    @Test
    public void testSingleStatusCheckGivesNoLimits() {
        expectGet(PARAMETERS_PATH).andRespond(json(complexRecord(
                check("STATUS", "\"ON\"", "\"\"", false, "STATUS"))));

        ParameterInfo info = parametersClient.getParameterInfo("NCADAF41", PROVIDER, Representation.COMPLEX);

        assertFalse(info.getLimits().hasLimits());
        assertEquals("STATUS", info.getCheckInterpretation());
        assertEquals("Tank temperature", info.getDescription());
        server.verify();
    }

    @Test
    public void testNonNumericHardLimitIsTransportFailure() {
        expectGet(PARAMETERS_PATH).andRespond(json(complexRecord(
                check("HARD", "\"low\"", 10, true, "ENGINEERING"))));

        assertThrows(TransportException.class,
                () -> parametersClient.getParameterInfo("NCADAF41", PROVIDER, Representation.COMPLEX));
    }

    @Test
    public void testMixedCheckFlagsAreAbsent() {
        expectGet(PARAMETERS_PATH).andRespond(json(complexRecord(
                check("SOFT", 1, 9, true, "ENGINEERING"),
                check("HARD", 0, 10, false, "RAW"))));

        ParameterInfo info = parametersClient.getParameterInfo("NCADAF41", PROVIDER, Representation.COMPLEX);

        assertNull(info.getCheckCalibrated());
        assertNull(info.getCheckInterpretation());
        assertEquals(1.0, info.getSoftLow());
        assertEquals(10.0, info.getHardHigh());
        server.verify();
    }

    @Test
    public void testUnknownParameter() {
        expectGet(PARAMETERS_PATH).andRespond(json("[]"));

        assertThrows(UnknownParameterException.class, () -> parametersClient.getParameterInfo("NOPE", PROVIDER));
        server.verify();
    }

    @Test
    public void testMalformedSampleBoundIsTransportFailure() {
        expectGet(PARAMETERS_PATH).andRespond(json("{\"Name\":\"NCADAF41\",\"First Sample\":\"yesterday\"}"));

        assertThrows(TransportException.class, () -> parametersClient.getParameterInfo("NCADAF41", PROVIDER));
        server.verify();
    }

    @Test
    public void testSearchByDescription() {
        expectGet(PARAMETERS_PATH)
                .andExpect(query("key", "Description"))
                .andExpect(query("value", "temperature"))
                .andExpect(query("search", "true"))
                .andRespond(json("[{\"Name\":\"NCADAF41\",\"Description\":\"Tank temperature\",\"First Sample\":\"N/A\"},"
                        + "{\"Name\":\"NCADAF42\",\"Description\":\"Line temperature\","
                        + "\"Last Sample\":\"2024-02-01 10:00:00.500\"}]"));

        List<ParameterInfo> matches = parametersClient.searchParameters("temperature", SearchField.DESCRIPTION, null);

        assertEquals(2, matches.size());
        assertEquals("NCADAF41", matches.get(0).getName());
        assertNull(matches.get(0).getFirstSample());
        assertEquals(Instant.parse("2024-02-01T10:00:00.500Z"), matches.get(1).getLastSample());
        server.verify();
    }

    @Test
    public void testSearchByName() {
        expectGet(PARAMETERS_PATH)
                .andExpect(query("key", "Name"))
                .andRespond(json("[{\"Name\":\"NCADAF41\"}]"));

        assertEquals(1, parametersClient.searchParameters("NCAD", "name", PROVIDER).size());
        server.verify();
    }

    @Test
    public void testSearchWithInvalidFieldFailsLocally() {
        assertThrows(InvalidArgumentException.class, () -> parametersClient.searchParameters("x", "unit", PROVIDER));
        server.verify();
    }

    @Test
    public void testSearchWithoutMatches() {
        expectGet(PARAMETERS_PATH).andRespond(json("[]"));

        assertThrows(EmptyResultException.class,
                () -> parametersClient.searchParameters("nothing", SearchField.NAME, PROVIDER));
        server.verify();
    }

    @Test
    public void testTreeSearchReturnsFirstNodeOfProvider() {
        expectGet("/metadata/treesearch")
                .andExpect(query("field", "Name,Description"))
                .andExpect(query("text", "tank"))
                .andExpect(query("dataproviders", PROVIDER))
                .andRespond(json("[{\"type\":\"PLATO.parameter\",\"id\":1},"
                        + "{\"type\":\"BEPICOLOMBO.parameter\",\"id\":2},"
                        + "{\"type\":\"BEPICOLOMBO.folder\",\"id\":3}]"));

        Optional<CatalogNode> node = parametersClient.treeSearch("tank", null, PROVIDER);

        assertTrue(node.isPresent());
        assertEquals(2, node.get().get("id"));
        server.verify();
    }

    @Test
    public void testTreeSearchWithoutProviderNode() {
        expectGet("/metadata/treesearch").andRespond(json("[{\"type\":\"PLATO.parameter\"}]"));

        assertTrue(parametersClient.treeSearch("tank", "Name", PROVIDER).isEmpty());
        server.verify();
    }
}
