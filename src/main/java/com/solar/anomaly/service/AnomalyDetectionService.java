package com.solar.anomaly.service;

import com.solar.anomaly.config.DetectionConfig;
import com.solar.anomaly.config.MetricsConfig;
import com.solar.anomaly.engine.DailyEnergyAggregator;
import com.solar.anomaly.engine.DetectionEngine;
import com.solar.anomaly.exception.ResourceNotFoundException;
import com.solar.anomaly.model.Anomaly;
import com.solar.anomaly.model.AnomalyFinding;
import com.solar.anomaly.model.DailyAggregate;
import com.solar.anomaly.model.SolarUnit;
import com.solar.anomaly.model.UnitDetectionResult;
import com.solar.anomaly.repository.AnomalyRepository;
import com.solar.anomaly.repository.SolarUnitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Per-unit analysis: aggregate the window, run the detectors, and optionally
 * persist the findings with deduplication.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final SolarUnitRepository unitRepository;
    private final AnomalyRepository anomalyRepository;
    private final DailyEnergyAggregator aggregator;
    private final DetectionEngine detectionEngine;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyDetectionService(SolarUnitRepository unitRepository,
                                   AnomalyRepository anomalyRepository,
                                   DailyEnergyAggregator aggregator,
                                   DetectionEngine detectionEngine,
                                   DetectionConfig config,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.unitRepository = unitRepository;
        this.anomalyRepository = anomalyRepository;
        this.aggregator = aggregator;
        this.detectionEngine = detectionEngine;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Dry analysis of one unit. Findings are returned, never stored.
     */
    public UnitDetectionResult detectForDevice(String unitId, int windowDays) {
        if (windowDays < 1 || windowDays > config.getMaxWindowDays()) {
            throw new IllegalArgumentException(String.format(
                    "windowDays must be between 1 and %d, got %d", config.getMaxWindowDays(), windowDays));
        }
        SolarUnit unit = unitRepository.findById(unitId);
        if (unit == null) {
            throw new ResourceNotFoundException("Solar unit", unitId);
        }

        List<DailyAggregate> series = aggregator.aggregate(unitId, windowDays);
        List<AnomalyFinding> findings = detectionEngine.detectAll(series, unit);
        log.info("On-demand analysis of unit {} over {} days: {} aggregates, {} findings",
                unitId, windowDays, series.size(), findings.size());
        return new UnitDetectionResult(unitId, windowDays, series.size(), findings.size(), findings);
    }

    /**
     * Run the detectors over the configured window for a unit already loaded
     * from the directory.
     */
    public List<AnomalyFinding> analyse(SolarUnit unit) {
        List<DailyAggregate> series = aggregator.aggregate(unit.getUnitId(), config.getWindowDays());
        return detectionEngine.detectAll(series, unit);
    }

    /**
     * Store findings that have no equivalent anomaly yet.
     *
     * @return number of anomalies actually inserted
     */
    public int persistFindings(List<AnomalyFinding> findings) {
        int inserted = 0;
        for (AnomalyFinding finding : findings) {
            Anomaly existing = anomalyRepository.findEquivalent(
                    finding.getUnitId(), finding.getAnomalyType(), finding.getAffectedPeriod());
            if (existing != null) {
                log.debug("Skipping duplicate {} for unit {} over {}",
                        finding.getAnomalyType(), finding.getUnitId(), finding.getAffectedPeriod());
                continue;
            }

            Anomaly anomaly = Anomaly.fromFinding(finding, clock.millis());
            if (anomalyRepository.insertIfAbsent(anomaly)) {
                inserted++;
                metricsConfig.recordAnomalyPersisted(anomaly.getAnomalyType().name(), anomaly.getSeverity().name());
                log.info("New {} anomaly {} for unit {} ({} to {})",
                        anomaly.getAnomalyType(), anomaly.getAnomalyId(), anomaly.getUnitId(),
                        anomaly.getAffectedPeriod().startDate(), anomaly.getAffectedPeriod().endDate());
            } else {
                log.warn("Anomaly {} was inserted concurrently, treating as duplicate", anomaly.getAnomalyId());
            }
        }
        return inserted;
    }
}
