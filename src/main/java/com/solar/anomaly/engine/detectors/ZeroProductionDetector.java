package com.solar.anomaly.engine.detectors;

import com.solar.anomaly.config.DetectionConfig;
import com.solar.anomaly.engine.AnomalyDetector;
import com.solar.anomaly.model.AffectedPeriod;
import com.solar.anomaly.model.AnomalyFinding;
import com.solar.anomaly.model.AnomalyType;
import com.solar.anomaly.model.DailyAggregate;
import com.solar.anomaly.model.DetectionDetails;
import com.solar.anomaly.model.SolarUnit;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Detects days with (near) zero production.
 *
 * Logic: a day whose total is at or below 1% of rated capacity is a failure
 * day. Expected output is taken as 50% of capacity, so the estimated loss is
 * that expectation minus what was produced.
 *
 * Example: capacity 5000 W gives a threshold of 50. A day totalling 20 is
 * flagged with expected=2500, actual=20, loss=2480.
 */
@Component
public class ZeroProductionDetector implements AnomalyDetector {

    private final DetectionConfig config;

    public ZeroProductionDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.ZERO_PRODUCTION;
    }

    @Override
    public List<AnomalyFinding> detect(List<DailyAggregate> series, SolarUnit unit) {
        List<AnomalyFinding> findings = new ArrayList<>();
        double capacity = unit.getCapacityWatts();
        if (capacity <= 0) {
            return findings;
        }

        DetectionConfig.DetectorDefaults defaults = config.getDetectors();
        double threshold = capacity * defaults.getZeroProductionCapacityPct() / 100.0;
        double expected = capacity * defaults.getZeroProductionExpectedCapacityPct() / 100.0;

        for (DailyAggregate day : series) {
            if (day.totalEnergy() > threshold) {
                continue;
            }

            String description = String.format(
                    "Zero energy production detected on %s. Total output: %.2f kWh " +
                            "(threshold %.2f kWh, %s%% of %.0f W capacity).",
                    day.date(), day.totalEnergy(), threshold,
                    BigDecimal.valueOf(defaults.getZeroProductionCapacityPct()).stripTrailingZeros().toPlainString(),
                    capacity);

            findings.add(AnomalyFinding.builder()
                    .unitId(unit.getUnitId())
                    .anomalyType(AnomalyType.ZERO_PRODUCTION)
                    .affectedPeriod(AffectedPeriod.singleDay(day.date()))
                    .description(description)
                    .detectionDetails(DetectionDetails.builder()
                            .method("absolute_threshold")
                            .expectedValue(expected)
                            .actualValue(day.totalEnergy())
                            .deviationPercent(100.0)
                            .threshold(threshold)
                            .context(Map.of("systemCapacity", capacity))
                            .build())
                    .estimatedEnergyLoss(Math.max(0.0, expected - day.totalEnergy()))
                    .build());
        }
        return findings;
    }
}
