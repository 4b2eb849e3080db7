package io.mustlink.api.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Soft and hard limits plus check flags distilled from a parameter's monitoring checks.
 * <p>
 * At most two checks are supported. Anything the checks do not determine unambiguously
 * (a third check, two checks of one type, flags that differ between checks) is left absent.
 */
public class MonitoringLimits {

    private static final Logger logger = LoggerFactory.getLogger(MonitoringLimits.class);

    public static final int MAX_SUPPORTED_CHECKS = 2;

    private Double softLow;
    private Double softHigh;
    private Double hardLow;
    private Double hardHigh;
    private Boolean checkCalibrated;
    private String checkInterpretation;
    private final int checkCount;

    private MonitoringLimits(int checkCount) {
        this.checkCount = checkCount;
    }

    public static MonitoringLimits none() {
        return new MonitoringLimits(0);
    }

    /**
     * @throws NumberFormatException if a soft or hard check carries a non-numeric limit
     */
    public static MonitoringLimits extract(String parameter, List<MonitoringCheck> checks) {
        MonitoringLimits limits = new MonitoringLimits(checks.size());
        if (checks.isEmpty()) {
            return limits;
        }

        Set<Boolean> calibrationModes = new HashSet<>();
        Set<String> interpretations = new HashSet<>();
        for (MonitoringCheck check : checks) {
            calibrationModes.add(check.getUseCalibrated());
            interpretations.add(check.getInterpretation());
        }
        if (calibrationModes.size() > 1) {
            logger.warn("Mixed calibration type in checks of {}, ignoring", parameter);
        } else {
            limits.checkCalibrated = calibrationModes.iterator().next();
        }
        if (interpretations.size() > 1) {
            logger.warn("Mixed interpretation type in checks of {}, ignoring", parameter);
        } else {
            limits.checkInterpretation = interpretations.iterator().next();
        }

        if (checks.size() > MAX_SUPPORTED_CHECKS) {
            logger.warn("Extracting limits for {} with {} checks is not supported", parameter, checks.size());
            return limits;
        }

        long softChecks = checks.stream().filter(c -> c.getType() == MonitoringCheck.CheckType.SOFT).count();
        long hardChecks = checks.stream().filter(c -> c.getType() == MonitoringCheck.CheckType.HARD).count();
        if (softChecks > 1 || hardChecks > 1) {
            logger.warn("Parameter {} has more than one check of the same type, ignoring limits", parameter);
            return limits;
        }

        for (MonitoringCheck check : checks) {
            switch (check.getType()) {
                case SOFT:
                    limits.softLow = check.getLowLimit();
                    limits.softHigh = check.getHighLimit();
                    break;
                case HARD:
                    limits.hardLow = check.getLowLimit();
                    limits.hardHigh = check.getHighLimit();
                    break;
                default:
                    logger.warn("Unsupported check type {} for {}", check.getRawType(), parameter);
                    break;
            }
        }
        return limits;
    }

    public Double getSoftLow() {
        return softLow;
    }

    public Double getSoftHigh() {
        return softHigh;
    }

    public Double getHardLow() {
        return hardLow;
    }

    public Double getHardHigh() {
        return hardHigh;
    }

    public Boolean getCheckCalibrated() {
        return checkCalibrated;
    }

    public String getCheckInterpretation() {
        return checkInterpretation;
    }

    public int getCheckCount() {
        return checkCount;
    }

    public boolean hasLimits() {
        return softLow != null || softHigh != null || hardLow != null || hardHigh != null;
    }

    @Override
    public String toString() {
        return "soft=[" + softLow + ", " + softHigh + "] hard=[" + hardLow + ", " + hardHigh + "]"
                + (checkInterpretation == null ? "" : " " + checkInterpretation);
    }
}
