package com.solar.anomaly.model;

/**
 * Closed set of anomaly types. Severity, recommended action and whether an
 * energy-loss estimate applies are fixed per type.
 */
public enum AnomalyType {

    ZERO_PRODUCTION(Severity.CRITICAL, true,
            "Immediately inspect the solar unit, check electrical connections, and verify inverter status."),

    SIGNIFICANT_DROP(Severity.WARNING, true,
            "Check for new shading sources, dirt accumulation on panels, or partial equipment failure."),

    GRADUAL_DEGRADATION(Severity.WARNING, false,
            "Schedule maintenance to inspect panel condition. Consider cleaning panels and checking for equipment wear."),

    SENSOR_SPIKE(Severity.INFO, false,
            "Check sensor calibration and data transmission. This reading likely indicates a sensor malfunction."),

    INTERMITTENT_FAILURE(Severity.WARNING, true,
            "Check electrical connections, inverter, and wiring for loose connections or intermittent faults."),

    BELOW_THRESHOLD(Severity.INFO, false,
            "Review system installation, check for persistent shading, or consider system inspection for underlying issues.");

    private final Severity severity;
    private final boolean lossEstimable;
    private final String recommendedAction;

    AnomalyType(Severity severity, boolean lossEstimable, String recommendedAction) {
        this.severity = severity;
        this.lossEstimable = lossEstimable;
        this.recommendedAction = recommendedAction;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isLossEstimable() {
        return lossEstimable;
    }

    public String getRecommendedAction() {
        return recommendedAction;
    }
}
