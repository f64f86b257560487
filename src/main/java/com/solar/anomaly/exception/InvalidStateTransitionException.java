package com.solar.anomaly.exception;

import com.solar.anomaly.model.AnomalyStatus;

/**
 * A resolution action was attempted from a status that does not allow it.
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final String anomalyId;
    private final AnomalyStatus currentStatus;
    private final AnomalyStatus targetStatus;

    public InvalidStateTransitionException(String anomalyId, AnomalyStatus currentStatus, AnomalyStatus targetStatus) {
        super(String.format("Anomaly %s cannot move from %s to %s", anomalyId, currentStatus, targetStatus));
        this.anomalyId = anomalyId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public AnomalyStatus getCurrentStatus() {
        return currentStatus;
    }

    public AnomalyStatus getTargetStatus() {
        return targetStatus;
    }
}
