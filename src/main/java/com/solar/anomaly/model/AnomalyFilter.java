package com.solar.anomaly.model;

/**
 * Optional query filters for anomaly listings. Null fields match everything.
 */
public record AnomalyFilter(String unitId,
                            AnomalyType anomalyType,
                            Severity severity,
                            AnomalyStatus status,
                            int limit,
                            int offset) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    public AnomalyFilter {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
        offset = Math.max(0, offset);
    }

    public AnomalyFilter forUnit(String unitId) {
        return new AnomalyFilter(unitId, anomalyType, severity, status, limit, offset);
    }

    public boolean matches(Anomaly anomaly) {
        if (unitId != null && !unitId.equals(anomaly.getUnitId())) return false;
        if (anomalyType != null && anomalyType != anomaly.getAnomalyType()) return false;
        if (severity != null && severity != anomaly.getSeverity()) return false;
        if (status != null && status != anomaly.getStatus()) return false;
        return true;
    }
}
