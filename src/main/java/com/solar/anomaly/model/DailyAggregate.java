package com.solar.anomaly.model;

import java.time.LocalDate;

/**
 * Total energy produced by one unit on one calendar day.
 */
public record DailyAggregate(LocalDate date, double totalEnergy) {}
