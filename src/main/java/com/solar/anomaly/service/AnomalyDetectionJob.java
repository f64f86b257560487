package com.solar.anomaly.service;

import com.solar.anomaly.config.DetectionConfig;
import com.solar.anomaly.config.MetricsConfig;
import com.solar.anomaly.exception.UpstreamUnavailableException;
import com.solar.anomaly.model.AnomalyFinding;
import com.solar.anomaly.model.DetectionRunResult;
import com.solar.anomaly.model.SolarUnit;
import com.solar.anomaly.repository.SolarUnitRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Batch detection over every active unit.
 *
 * Flow:
 * 1. List active units from the device directory (failure aborts the run)
 * 2. For each unit: aggregate, detect, persist new anomalies
 * 3. Isolate per-unit failures and report them in the run summary
 */
@Service
public class AnomalyDetectionJob {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionJob.class);

    static final String TRIGGER_SCHEDULED = "scheduled";
    static final String TRIGGER_MANUAL = "manual";

    private final SolarUnitRepository unitRepository;
    private final AnomalyDetectionService detectionService;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyDetectionJob(SolarUnitRepository unitRepository,
                               AnomalyDetectionService detectionService,
                               DetectionConfig config,
                               MetricsConfig metricsConfig,
                               Clock clock) {
        this.unitRepository = unitRepository;
        this.detectionService = detectionService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Scheduled(cron = "#{@detectionConfig.job.cron}", zone = "UTC")
    public void runScheduled() {
        if (!config.getJob().isEnabled()) {
            return;
        }
        try {
            run(TRIGGER_SCHEDULED);
        } catch (UpstreamUnavailableException e) {
            log.error("Scheduled detection run aborted: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Scheduled detection run failed unexpectedly", e);
        }
    }

    /**
     * On-demand run. Same semantics as the scheduled run, but failures to reach
     * the device directory propagate to the caller.
     */
    @Observed(name = "detection.run", contextualName = "run-detection-job")
    public DetectionRunResult runDetectionJob() {
        return run(TRIGGER_MANUAL);
    }

    private DetectionRunResult run(String trigger) {
        long startedAt = clock.millis();
        log.info("Detection run started (trigger={}, windowDays={})", trigger, config.getWindowDays());

        List<SolarUnit> units;
        try {
            units = unitRepository.findActive();
        } catch (RuntimeException e) {
            metricsConfig.recordDetectionRunFailed(trigger);
            throw new UpstreamUnavailableException("Device directory unavailable: " + e.getMessage(), e);
        }

        int processed = 0;
        int anomaliesFound = 0;
        int newAnomalies = 0;
        int failedUnits = 0;

        for (SolarUnit unit : units) {
            processed++;
            try {
                List<AnomalyFinding> findings = detectionService.analyse(unit);
                anomaliesFound += findings.size();
                newAnomalies += detectionService.persistFindings(findings);
            } catch (Exception e) {
                failedUnits++;
                metricsConfig.recordUnitFailure();
                log.error("Detection failed for unit {}: {}", unit.getUnitId(), e.getMessage(), e);
            }
        }

        long durationMs = clock.millis() - startedAt;
        metricsConfig.recordDetectionRun(trigger, processed, Duration.ofMillis(durationMs));
        log.info("Detection run complete: processed={}, anomaliesFound={}, newAnomalies={}, failedUnits={}, durationMs={}",
                processed, anomaliesFound, newAnomalies, failedUnits, durationMs);

        return DetectionRunResult.builder()
                .processed(processed)
                .anomaliesFound(anomaliesFound)
                .newAnomalies(newAnomalies)
                .failedUnits(failedUnits)
                .startedAt(startedAt)
                .durationMs(durationMs)
                .build();
    }
}
