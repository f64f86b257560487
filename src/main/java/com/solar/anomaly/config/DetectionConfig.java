package com.solar.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Trailing window of daily aggregates analysed per unit.
    private int windowDays = 14;

    // Upper bound accepted for on-demand single-unit analysis.
    private int maxWindowDays = 90;

    private Job job = new Job();

    private DetectorDefaults detectors = new DetectorDefaults();

    private Stats stats = new Stats();

    @Data
    public static class Job {
        private boolean enabled = true;
        // Spring cron (with seconds). Default: every 6 hours.
        private String cron = "0 0 */6 * * *";
    }

    @Data
    public static class DetectorDefaults {
        // ZERO_PRODUCTION
        private double zeroProductionCapacityPct = 1.0;
        private double zeroProductionExpectedCapacityPct = 50.0;

        // SIGNIFICANT_DROP
        private double significantDropPct = 50.0;
        private int significantDropMinDays = 3;

        // GRADUAL_DEGRADATION
        private double degradationDeclinePct = 15.0;
        private int degradationMinDays = 7;

        // SENSOR_SPIKE
        private double spikePeakSunHours = 8.0;
        private double spikeMultiplier = 1.5;

        // INTERMITTENT_FAILURE
        private double intermittentFailureCapacityPct = 5.0;
        private int intermittentMinDays = 5;
        private int intermittentMinFailureDays = 2;
        private int intermittentMinRecoveryDays = 2;

        // BELOW_THRESHOLD
        private double belowThresholdSunHours = 4.0;
        private double belowThresholdPct = 20.0;
        private int belowThresholdMinDays = 3;
        private double belowThresholdDaySharePct = 50.0;
    }

    @Data
    public static class Stats {
        private int trendDays = 30;
    }
}
