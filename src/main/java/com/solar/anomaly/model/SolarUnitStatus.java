package com.solar.anomaly.model;

public enum SolarUnitStatus {
    ACTIVE,
    INACTIVE,
    MAINTENANCE
}
