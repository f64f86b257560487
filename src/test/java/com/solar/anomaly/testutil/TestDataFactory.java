package com.solar.anomaly.testutil;

import com.solar.anomaly.model.AffectedPeriod;
import com.solar.anomaly.model.Anomaly;
import com.solar.anomaly.model.AnomalyFinding;
import com.solar.anomaly.model.AnomalyStatus;
import com.solar.anomaly.model.AnomalyType;
import com.solar.anomaly.model.DailyAggregate;
import com.solar.anomaly.model.DetectionDetails;
import com.solar.anomaly.model.SolarUnit;
import com.solar.anomaly.model.SolarUnitStatus;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared factory for creating test objects across all test classes.
 */
public final class TestDataFactory {

    public static final LocalDate START = LocalDate.of(2026, 10, 1);

    private TestDataFactory() {}

    public static SolarUnit createUnit(String unitId, double capacityWatts) {
        return SolarUnit.builder()
                .unitId(unitId)
                .serialNumber("SN-" + unitId)
                .capacityWatts(capacityWatts)
                .status(SolarUnitStatus.ACTIVE)
                .installationDate(LocalDate.of(2025, 8, 1))
                .build();
    }

    /**
     * Consecutive daily aggregates starting at {@link #START}.
     */
    public static List<DailyAggregate> series(double... totals) {
        List<DailyAggregate> series = new ArrayList<>();
        for (int i = 0; i < totals.length; i++) {
            series.add(new DailyAggregate(START.plusDays(i), totals[i]));
        }
        return series;
    }

    public static AnomalyFinding createFinding(String unitId, AnomalyType type, LocalDate start, LocalDate end) {
        return AnomalyFinding.builder()
                .unitId(unitId)
                .anomalyType(type)
                .affectedPeriod(new AffectedPeriod(start, end))
                .description(type + " on " + unitId)
                .detectionDetails(DetectionDetails.builder().method("test").build())
                .build();
    }

    public static Anomaly createAnomaly(String unitId, AnomalyType type, AnomalyStatus status, long detectedAt) {
        Anomaly anomaly = Anomaly.fromFinding(createFinding(unitId, type, START, START), detectedAt);
        anomaly.setStatus(status);
        return anomaly;
    }
}
