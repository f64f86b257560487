package com.solar.anomaly.model;

public enum Severity {
    CRITICAL,
    WARNING,
    INFO
}
