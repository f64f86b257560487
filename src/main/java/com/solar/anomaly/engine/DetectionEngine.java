package com.solar.anomaly.engine;

import com.solar.anomaly.config.MetricsConfig;
import com.solar.anomaly.model.AnomalyFinding;
import com.solar.anomaly.model.AnomalyType;
import com.solar.anomaly.model.DailyAggregate;
import com.solar.anomaly.model.SolarUnit;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered detector against a unit's daily series.
 * Uses the Strategy pattern: each AnomalyType is handled by one AnomalyDetector bean.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<AnomalyType, AnomalyDetector> detectorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public DetectionEngine(List<AnomalyDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(AnomalyType.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (AnomalyDetector detector : detectors) {
            AnomalyDetector previous = detectorMap.put(detector.getSupportedType(), detector);
            if (previous != null) {
                throw new IllegalStateException("Two detectors registered for " + detector.getSupportedType()
                        + ": " + previous.getClass().getSimpleName() + ", " + detector.getClass().getSimpleName());
            }
            log.info("Registered anomaly detector: {} -> {}",
                    detector.getSupportedType(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run all detectors in AnomalyType order.
     *
     * @return findings of all detectors; a detector that throws contributes nothing
     */
    public List<AnomalyFinding> detectAll(List<DailyAggregate> series, SolarUnit unit) {
        if (series.isEmpty()) {
            return Collections.emptyList();
        }

        List<AnomalyFinding> findings = new ArrayList<>();
        for (AnomalyDetector detector : detectorMap.values()) {
            AnomalyType type = detector.getSupportedType();
            Span span = tracer.nextSpan()
                    .name("detector." + type.name().toLowerCase())
                    .tag("unit.id", unit.getUnitId())
                    .tag("series.days", String.valueOf(series.size()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                List<AnomalyFinding> detected = detector.detect(series, unit);
                span.tag("findings", String.valueOf(detected.size()));
                for (AnomalyFinding finding : detected) {
                    metricsConfig.recordAnomalyDetected(type.name());
                    log.debug("{} detected for unit {}: {}", type, unit.getUnitId(), finding.getDescription());
                }
                findings.addAll(detected);
            } catch (Exception e) {
                span.error(e);
                log.error("Detector {} failed for unit {}: {}", type, unit.getUnitId(), e.getMessage(), e);
            } finally {
                span.end();
            }
        }
        return findings;
    }

    public Map<AnomalyType, AnomalyDetector> getRegisteredDetectors() {
        return Collections.unmodifiableMap(detectorMap);
    }
}
