package com.solar.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A raw reading as written by the external sync process.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnergyReading {
    private String readingId;
    private String unitId;
    private long timestamp;             // epoch millis
    private double energyGenerated;     // kWh over the interval
    @Builder.Default
    private double intervalHours = 2.0;
}
