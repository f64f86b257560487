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
 * Detects a steady decline across the window using least-squares regression.
 *
 * Logic: fit total = a + slope * day over the window. The implied decline over
 * the window is slope * spanDays. If the slope is negative and that decline is
 * strictly more than 15% of the window mean, the whole window is flagged.
 *
 * Example: 14 days falling by 10 kWh/day from 500 give slope=-10, decline=130
 * against a mean of 435, i.e. 29.9%.
 */
@Component
public class GradualDegradationDetector implements AnomalyDetector {

    private final DetectionConfig config;

    public GradualDegradationDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.GRADUAL_DEGRADATION;
    }

    @Override
    public List<AnomalyFinding> detect(List<DailyAggregate> series, SolarUnit unit) {
        List<AnomalyFinding> findings = new ArrayList<>();
        DetectionConfig.DetectorDefaults defaults = config.getDetectors();
        if (series.size() < defaults.getDegradationMinDays()) {
            return findings;
        }

        double mean = SeriesMath.mean(series);
        double slope = SeriesMath.slope(series);
        if (mean <= 0 || Double.isNaN(slope) || slope >= 0) {
            return findings;
        }

        long spanDays = SeriesMath.spanDays(series);
        double totalDecline = slope * spanDays;
        double declinePct = Math.abs(totalDecline) * 100.0 / mean;
        double thresholdPct = defaults.getDegradationDeclinePct();
        if (declinePct <= thresholdPct) {
            return findings;
        }

        DailyAggregate first = series.get(0);
        DailyAggregate last = series.get(series.size() - 1);

        String description = String.format(
                "Gradual degradation detected: production declined %.1f%% over %d days (%s to %s). " +
                        "Average daily decline: %.2f kWh.",
                declinePct, spanDays + 1, first.date(), last.date(), Math.abs(slope));

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("slope", slope);
        context.put("totalDecline", totalDecline);
        context.put("windowSize", series.size());
        context.put("averageEnergy", mean);

        findings.add(AnomalyFinding.builder()
                .unitId(unit.getUnitId())
                .anomalyType(AnomalyType.GRADUAL_DEGRADATION)
                .affectedPeriod(new AffectedPeriod(first.date(), last.date()))
                .description(description)
                .detectionDetails(DetectionDetails.builder()
                        .method("linear_regression")
                        .expectedValue(first.totalEnergy())
                        .actualValue(last.totalEnergy())
                        .deviationPercent(declinePct)
                        .threshold(thresholdPct)
                        .context(context)
                        .build())
                .build());
        return findings;
    }
}
