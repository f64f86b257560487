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

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects sporadic failures: near-zero days that come and go.
 *
 * Logic: a day at or below 5% of capacity is a failure day, any other day is a
 * recovery day. The window is flagged when there are at least 2 failure days,
 * at least 2 recovery days, and two successive failure days are more than one
 * calendar day apart. A single outage spanning consecutive days is not
 * intermittent. Missing days between two failure days still count as a gap.
 */
@Component
public class IntermittentFailureDetector implements AnomalyDetector {

    private final DetectionConfig config;

    public IntermittentFailureDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.INTERMITTENT_FAILURE;
    }

    @Override
    public List<AnomalyFinding> detect(List<DailyAggregate> series, SolarUnit unit) {
        List<AnomalyFinding> findings = new ArrayList<>();
        DetectionConfig.DetectorDefaults defaults = config.getDetectors();
        double capacity = unit.getCapacityWatts();
        if (capacity <= 0 || series.size() < defaults.getIntermittentMinDays()) {
            return findings;
        }

        double threshold = capacity * defaults.getIntermittentFailureCapacityPct() / 100.0;
        List<Integer> failureIndexes = new ArrayList<>();
        int recoveryDays = 0;
        for (int i = 0; i < series.size(); i++) {
            if (series.get(i).totalEnergy() <= threshold) {
                failureIndexes.add(i);
            } else {
                recoveryDays++;
            }
        }

        if (failureIndexes.size() < defaults.getIntermittentMinFailureDays()
                || recoveryDays < defaults.getIntermittentMinRecoveryDays()
                || !hasGapBetweenFailures(series, failureIndexes)) {
            return findings;
        }

        List<String> failureDays = failureIndexes.stream()
                .map(i -> series.get(i).date().toString())
                .toList();
        DailyAggregate first = series.get(0);
        DailyAggregate last = series.get(series.size() - 1);

        String description = String.format(
                "Intermittent failure pattern detected: %d failure days out of %d days (%s), " +
                        "with %d recovery days in between.",
                failureDays.size(), series.size(), String.join(", ", failureDays), recoveryDays);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("failureDays", failureDays);
        context.put("recoveryDays", recoveryDays);
        context.put("totalDays", series.size());

        double expectedPerDay = capacity * defaults.getZeroProductionExpectedCapacityPct() / 100.0;

        findings.add(AnomalyFinding.builder()
                .unitId(unit.getUnitId())
                .anomalyType(AnomalyType.INTERMITTENT_FAILURE)
                .affectedPeriod(new AffectedPeriod(first.date(), last.date()))
                .description(description)
                .detectionDetails(DetectionDetails.builder()
                        .method("pattern_analysis")
                        .threshold(threshold)
                        .context(context)
                        .build())
                .estimatedEnergyLoss(failureDays.size() * expectedPerDay)
                .build());
        return findings;
    }

    private static boolean hasGapBetweenFailures(List<DailyAggregate> series, List<Integer> failureIndexes) {
        for (int k = 1; k < failureIndexes.size(); k++) {
            long daysBetween = ChronoUnit.DAYS.between(
                    series.get(failureIndexes.get(k - 1)).date(), series.get(failureIndexes.get(k)).date());
            if (daysBetween > 1) {
                return true;
            }
        }
        return false;
    }
}
