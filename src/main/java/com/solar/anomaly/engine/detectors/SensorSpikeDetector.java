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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects physically implausible daily totals, most likely sensor faults.
 *
 * Logic: the plausible daily maximum is capacity * 8 peak sun hours. A day
 * strictly above 1.5x that maximum is flagged.
 */
@Component
public class SensorSpikeDetector implements AnomalyDetector {

    private final DetectionConfig config;

    public SensorSpikeDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.SENSOR_SPIKE;
    }

    @Override
    public List<AnomalyFinding> detect(List<DailyAggregate> series, SolarUnit unit) {
        List<AnomalyFinding> findings = new ArrayList<>();
        double capacity = unit.getCapacityWatts();
        if (capacity <= 0) {
            return findings;
        }

        DetectionConfig.DetectorDefaults defaults = config.getDetectors();
        double peakSunHours = defaults.getSpikePeakSunHours();
        double maxDailyOutput = capacity * peakSunHours;
        double spikeThreshold = maxDailyOutput * defaults.getSpikeMultiplier();

        for (DailyAggregate day : series) {
            if (day.totalEnergy() <= spikeThreshold) continue;

            double deviationPct = (day.totalEnergy() - maxDailyOutput) / maxDailyOutput * 100.0;
            String description = String.format(
                    "Unrealistic energy reading detected: %.1f kWh on %s. Maximum expected: %.1f kWh.",
                    day.totalEnergy(), day.date(), maxDailyOutput);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("systemCapacity", capacity);
            context.put("maxPeakSunHours", peakSunHours);

            findings.add(AnomalyFinding.builder()
                    .unitId(unit.getUnitId())
                    .anomalyType(AnomalyType.SENSOR_SPIKE)
                    .affectedPeriod(AffectedPeriod.singleDay(day.date()))
                    .description(description)
                    .detectionDetails(DetectionDetails.builder()
                            .method("capacity_threshold")
                            .expectedValue(maxDailyOutput)
                            .actualValue(day.totalEnergy())
                            .deviationPercent(deviationPct)
                            .threshold(spikeThreshold)
                            .context(context)
                            .build())
                    .build());
        }
        return findings;
    }
}
