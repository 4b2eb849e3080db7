package io.mustlink.api.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.mustlink.api.model.MonitoringCheck.CheckType;

public class MonitoringLimitsTest {

    private static MonitoringCheck check(CheckType type, double low, double high) {
        return new MonitoringCheck(type, low, high, Boolean.FALSE, "ENGINEERING");
    }

    @Test
    public void testNoChecks() {
        MonitoringLimits limits = MonitoringLimits.extract("P", List.of());

        assertFalse(limits.hasLimits());
        assertNull(limits.getCheckCalibrated());
        assertEquals(0, limits.getCheckCount());
    }

    @Test
    public void testSingleHardCheck() {
        MonitoringLimits limits = MonitoringLimits.extract("P", List.of(check(CheckType.HARD, -5, 5)));

        assertNull(limits.getSoftLow());
        assertEquals(-5.0, limits.getHardLow());
        assertEquals(5.0, limits.getHardHigh());
        assertEquals(Boolean.FALSE, limits.getCheckCalibrated());
    }

    @Test
    public void testTwoChecksOfSameTypeAreIrreconcilable() {
        MonitoringLimits limits = MonitoringLimits.extract("P",
                List.of(check(CheckType.SOFT, 1, 9), check(CheckType.SOFT, 2, 8)));

        assertFalse(limits.hasLimits());
    }

    @Test
    public void testUnsupportedCheckTypeIgnored() {
        MonitoringCheck delta = MonitoringCheck.fromResponse(Map.of(
                "useCalibrated", "true",
                "checkInterpretation", "ENGINEERING",
                "checkDefinitions", Map.of("type", "DELTA", "lowValue", "1", "highValue", "2")));
        MonitoringLimits limits = MonitoringLimits.extract("P", List.of(delta, check(CheckType.SOFT, 1, 9)));

        assertEquals(CheckType.UNSUPPORTED, delta.getType());
        assertEquals("DELTA", delta.getRawType());
        assertEquals(1.0, limits.getSoftLow());
        assertNull(limits.getHardLow());
    }

    @Test
    public void testCheckFromResponseParsesNumbers() {
        MonitoringCheck check = MonitoringCheck.fromResponse(Map.of(
                "useCalibrated", true,
                "checkDefinitions", List.of(Map.of("type", "hard", "lowValue", "0.5", "highValue", 12))));

        assertEquals(CheckType.HARD, check.getType());
        assertEquals("0.5", check.getLowValue());
        assertEquals(0.5, check.getLowLimit());
        assertEquals(12.0, check.getHighLimit());
        assertEquals(Boolean.TRUE, check.getUseCalibrated());
        assertNull(check.getInterpretation());
    }

    @Test
    public void testNonNumericSoftLimitIsRejected() {
        MonitoringCheck soft = MonitoringCheck.fromResponse(Map.of(
                "checkDefinitions", Map.of("type", "SOFT", "lowValue", "low")));

        assertEquals("low", soft.getLowValue());
        assertThrows(NumberFormatException.class, () -> MonitoringLimits.extract("P", List.of(soft)));
    }

    @Test
    public void testStatusCheckWithTextLimitsIsIgnored() {
        MonitoringCheck status = MonitoringCheck.fromResponse(Map.of(
                "useCalibrated", false,
                "checkInterpretation", "STATUS",
                "checkDefinitions", Map.of("type", "STATUS", "lowValue", "ON", "highValue", "")));

        MonitoringLimits limits = MonitoringLimits.extract("P", List.of(status));

        assertEquals(CheckType.UNSUPPORTED, status.getType());
        assertFalse(limits.hasLimits());
        assertEquals("STATUS", limits.getCheckInterpretation());
        assertEquals(1, limits.getCheckCount());
    }

    @Test
    public void testThreeChecksWithTextLimitDegradeToNoLimits() {
        MonitoringCheck status = MonitoringCheck.fromResponse(Map.of(
                "useCalibrated", false,
                "checkInterpretation", "ENGINEERING",
                "checkDefinitions", Map.of("type", "STATUS", "lowValue", "ON", "highValue", "ON")));

        MonitoringLimits limits = MonitoringLimits.extract("P",
                List.of(check(CheckType.SOFT, 1, 9), check(CheckType.HARD, 0, 10), status));

        assertFalse(limits.hasLimits());
        assertEquals(3, limits.getCheckCount());
    }
}
