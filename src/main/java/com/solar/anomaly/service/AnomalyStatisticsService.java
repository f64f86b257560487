package com.solar.anomaly.service;

import com.solar.anomaly.config.DetectionConfig;
import com.solar.anomaly.exception.ResourceNotFoundException;
import com.solar.anomaly.model.Anomaly;
import com.solar.anomaly.model.AnomalyStats;
import com.solar.anomaly.repository.AnomalyRepository;
import com.solar.anomaly.repository.AnomalyRepository.GroupBy;
import com.solar.anomaly.repository.SolarUnitRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only rollups over stored anomalies, optionally restricted to one unit.
 */
@Service
public class AnomalyStatisticsService {

    private final AnomalyRepository anomalyRepository;
    private final SolarUnitRepository solarUnitRepository;
    private final DetectionConfig config;
    private final Clock clock;

    public AnomalyStatisticsService(AnomalyRepository anomalyRepository,
                                    SolarUnitRepository solarUnitRepository,
                                    DetectionConfig config,
                                    Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.solarUnitRepository = solarUnitRepository;
        this.config = config;
        this.clock = clock;
    }

    public AnomalyStats stats(String unitId) {
        if (unitId != null && solarUnitRepository.findById(unitId) == null) {
            throw new ResourceNotFoundException("Solar unit", unitId);
        }
        return AnomalyStats.builder()
                .byType(anomalyRepository.countGroupedBy(unitId, GroupBy.TYPE))
                .bySeverity(anomalyRepository.countGroupedBy(unitId, GroupBy.SEVERITY))
                .byStatus(anomalyRepository.countGroupedBy(unitId, GroupBy.STATUS))
                .recentTrend(trend(unitId))
                .build();
    }

    /**
     * Detections per UTC day of detectedAt over the trend window, oldest
     * first. Days without detections are omitted.
     */
    private List<AnomalyStats.TrendPoint> trend(String unitId) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate firstDay = today.minusDays(config.getStats().getTrendDays() - 1L);
        long since = firstDay.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();

        Map<LocalDate, AnomalyStats.TrendPoint> byDay = new TreeMap<>();
        for (Anomaly anomaly : anomalyRepository.findDetectedSince(unitId, since)) {
            LocalDate day = Instant.ofEpochMilli(anomaly.getDetectedAt()).atZone(ZoneOffset.UTC).toLocalDate();
            AnomalyStats.TrendPoint point = byDay.computeIfAbsent(day,
                    d -> AnomalyStats.TrendPoint.builder().date(d.toString()).build());
            point.setTotal(point.getTotal() + 1);
            switch (anomaly.getSeverity()) {
                case CRITICAL -> point.setCritical(point.getCritical() + 1);
                case WARNING -> point.setWarning(point.getWarning() + 1);
                case INFO -> point.setInfo(point.getInfo() + 1);
            }
        }
        return new ArrayList<>(byDay.values());
    }
}
