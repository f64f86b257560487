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
 * Detects single days producing far less than the window average.
 *
 * Logic: deviation = (mean - total) / mean * 100 over the whole window. A
 * non-zero day whose deviation is strictly above 50% is flagged. Zero days are
 * left to ZERO_PRODUCTION.
 *
 * Example: window mean 1000 kWh, a day of 400 kWh deviates 60%.
 */
@Component
public class SignificantDropDetector implements AnomalyDetector {

    private final DetectionConfig config;

    public SignificantDropDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.SIGNIFICANT_DROP;
    }

    @Override
    public List<AnomalyFinding> detect(List<DailyAggregate> series, SolarUnit unit) {
        List<AnomalyFinding> findings = new ArrayList<>();
        DetectionConfig.DetectorDefaults defaults = config.getDetectors();
        if (series.size() < defaults.getSignificantDropMinDays()) {
            return findings;
        }

        double mean = SeriesMath.mean(series);
        if (mean <= 0) {
            return findings;
        }
        double dropPct = defaults.getSignificantDropPct();

        for (DailyAggregate day : series) {
            if (day.totalEnergy() == 0) continue;

            double deviationPct = (mean - day.totalEnergy()) / mean * 100.0;
            if (deviationPct <= dropPct) continue;

            String description = String.format(
                    "Production dropped %.1f%% below the %d-day average on %s. " +
                            "Expected ~%.1f kWh, got %.1f kWh.",
                    deviationPct, series.size(), day.date(), mean, day.totalEnergy());

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("windowSize", series.size());
            context.put("windowAverage", mean);

            findings.add(AnomalyFinding.builder()
                    .unitId(unit.getUnitId())
                    .anomalyType(AnomalyType.SIGNIFICANT_DROP)
                    .affectedPeriod(AffectedPeriod.singleDay(day.date()))
                    .description(description)
                    .detectionDetails(DetectionDetails.builder()
                            .method("window_average_comparison")
                            .expectedValue(mean)
                            .actualValue(day.totalEnergy())
                            .deviationPercent(deviationPct)
                            .threshold(dropPct)
                            .context(context)
                            .build())
                    .estimatedEnergyLoss(mean - day.totalEnergy())
                    .build());
        }
        return findings;
    }
}
