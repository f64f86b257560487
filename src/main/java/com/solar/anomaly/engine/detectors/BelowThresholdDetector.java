package com.solar.anomaly.engine.detectors;

import com.solar.anomaly.config.DetectionConfig;
import com.solar.anomaly.engine.AnomalyDetector;
import com.solar.anomaly.engine.SeriesMath;
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
 * Detects persistent underperformance against a capacity-based baseline.
 *
 * Logic: the baseline is capacity * 4 average sun hours and the threshold is
 * 20% of it. Among days that produced anything, if at least half sit strictly
 * below the threshold, the whole window is flagged. Zero days are excluded
 * from both counts.
 */
@Component
public class BelowThresholdDetector implements AnomalyDetector {

    private final DetectionConfig config;

    public BelowThresholdDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.BELOW_THRESHOLD;
    }

    @Override
    public List<AnomalyFinding> detect(List<DailyAggregate> series, SolarUnit unit) {
        List<AnomalyFinding> findings = new ArrayList<>();
        DetectionConfig.DetectorDefaults defaults = config.getDetectors();
        double capacity = unit.getCapacityWatts();
        if (capacity <= 0 || series.size() < defaults.getBelowThresholdMinDays()) {
            return findings;
        }

        double baseline = capacity * defaults.getBelowThresholdSunHours();
        double thresholdPct = defaults.getBelowThresholdPct();
        double threshold = baseline * thresholdPct / 100.0;

        int nonZeroDays = 0;
        int belowDays = 0;
        for (DailyAggregate day : series) {
            if (day.totalEnergy() <= 0) continue;
            nonZeroDays++;
            if (day.totalEnergy() < threshold) {
                belowDays++;
            }
        }

        double requiredDays = Math.ceil(nonZeroDays * defaults.getBelowThresholdDaySharePct() / 100.0);
        if (belowDays == 0 || belowDays < requiredDays) {
            return findings;
        }

        double mean = SeriesMath.mean(series);
        DailyAggregate first = series.get(0);
        DailyAggregate last = series.get(series.size() - 1);

        String description = String.format(
                "System consistently underperforming: %d of %d producing days between %s and %s " +
                        "were below %.0f%% of the expected %.1f kWh. Average production: %.1f kWh.",
                belowDays, nonZeroDays, first.date(), last.date(), thresholdPct, baseline, mean);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("systemCapacity", capacity);
        context.put("expectedDailyOutput", baseline);
        context.put("belowThresholdDays", belowDays);
        context.put("nonZeroDays", nonZeroDays);
        context.put("averageProduction", mean);

        findings.add(AnomalyFinding.builder()
                .unitId(unit.getUnitId())
                .anomalyType(AnomalyType.BELOW_THRESHOLD)
                .affectedPeriod(new AffectedPeriod(first.date(), last.date()))
                .description(description)
                .detectionDetails(DetectionDetails.builder()
                        .method("capacity_percentage_threshold")
                        .expectedValue(baseline)
                        .actualValue(mean)
                        .threshold(threshold)
                        .context(context)
                        .build())
                .build());
        return findings;
    }
}
