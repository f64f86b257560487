package com.solar.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastRunProcessedUnits;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastRunProcessedUnits = registry.gauge("detection.run.last.processed_units", new AtomicInteger(0));
    }

    public void recordDetectionRun(String trigger, int processedUnits, Duration duration) {
        Counter.builder("detection.run.count")
                .tag("trigger", trigger)
                .register(registry)
                .increment();

        Timer.builder("detection.run.duration")
                .tag("trigger", trigger)
                .register(registry)
                .record(duration);

        lastRunProcessedUnits.set(processedUnits);
    }

    public void recordDetectionRunFailed(String trigger) {
        Counter.builder("detection.run.failed.count")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    public void recordAnomalyDetected(String anomalyType) {
        Counter.builder("anomaly.detected.count")
                .tag("anomaly_type", anomalyType)
                .register(registry)
                .increment();
    }

    public void recordAnomalyPersisted(String anomalyType, String severity) {
        Counter.builder("anomaly.persisted.count")
                .tag("anomaly_type", anomalyType)
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordUnitFailure() {
        Counter.builder("detection.unit.failed.count")
                .register(registry)
                .increment();
    }

    public void recordStatusTransition(String from, String to) {
        Counter.builder("anomaly.status.transition.count")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }
}
