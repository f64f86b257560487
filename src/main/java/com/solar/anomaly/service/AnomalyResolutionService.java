package com.solar.anomaly.service;

import com.solar.anomaly.config.MetricsConfig;
import com.solar.anomaly.exception.InvalidStateTransitionException;
import com.solar.anomaly.exception.ResourceNotFoundException;
import com.solar.anomaly.model.Anomaly;
import com.solar.anomaly.model.AnomalyStatus;
import com.solar.anomaly.repository.AnomalyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Operator-driven lifecycle of a stored anomaly.
 *
 * OPEN -> ACKNOWLEDGED -> RESOLVED | FALSE_POSITIVE, with OPEN also allowed
 * to go straight to either terminal state. Every write is conditional on the
 * status that was read, so two operators racing on the same anomaly cannot
 * both win.
 */
@Service
public class AnomalyResolutionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyResolutionService.class);

    static final String DEFAULT_ACTOR = "operator";

    private final AnomalyRepository anomalyRepository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyResolutionService(AnomalyRepository anomalyRepository,
                                    MetricsConfig metricsConfig,
                                    Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public Anomaly acknowledge(String anomalyId, String actor) {
        return transition(anomalyId, AnomalyStatus.ACKNOWLEDGED, actor, null);
    }

    public Anomaly resolve(String anomalyId, String actor, String notes) {
        return transition(anomalyId, AnomalyStatus.RESOLVED, actor, notes);
    }

    public Anomaly markFalsePositive(String anomalyId, String actor, String notes) {
        return transition(anomalyId, AnomalyStatus.FALSE_POSITIVE, actor, notes);
    }

    private Anomaly transition(String anomalyId, AnomalyStatus target, String actor, String notes) {
        Anomaly current = anomalyRepository.findById(anomalyId);
        if (current == null) {
            throw new ResourceNotFoundException("Anomaly", anomalyId);
        }
        AnomalyStatus from = current.getStatus();
        if (!from.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(anomalyId, from, target);
        }

        String who = (actor == null || actor.isBlank()) ? DEFAULT_ACTOR : actor;
        long now = clock.millis();
        Anomaly.AnomalyBuilder builder = current.toBuilder()
                .status(target)
                .updatedAt(now);
        if (target == AnomalyStatus.ACKNOWLEDGED) {
            builder.acknowledgedAt(now).acknowledgedBy(who);
        } else {
            builder.resolvedAt(now).resolvedBy(who);
            if (notes != null && !notes.isBlank()) {
                builder.resolutionNotes(notes);
            }
        }
        Anomaly updated = builder.build();

        if (!anomalyRepository.updateIfStatus(updated, from)) {
            Anomaly latest = anomalyRepository.findById(anomalyId);
            if (latest == null) {
                throw new ResourceNotFoundException("Anomaly", anomalyId);
            }
            log.warn("Anomaly {} changed concurrently to {} while moving {} -> {}",
                    anomalyId, latest.getStatus(), from, target);
            throw new InvalidStateTransitionException(anomalyId, latest.getStatus(), target);
        }

        metricsConfig.recordStatusTransition(from.name(), target.name());
        log.info("Anomaly {} moved {} -> {} by {}", anomalyId, from, target, who);
        return updated;
    }
}
