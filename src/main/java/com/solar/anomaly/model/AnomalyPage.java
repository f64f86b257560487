package com.solar.anomaly.model;

import java.util.List;

public record AnomalyPage(List<Anomaly> anomalies, long total) {}
