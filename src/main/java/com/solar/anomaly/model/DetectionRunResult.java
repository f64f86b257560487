package com.solar.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Summary of one detection run over all active units")
public class DetectionRunResult {

    @Schema(description = "Active units analysed (including units whose analysis failed)", example = "12")
    private int processed;

    @Schema(description = "Findings produced by detectors, including ones already stored", example = "7")
    private int anomaliesFound;

    @Schema(description = "Findings stored as new OPEN anomalies", example = "2")
    private int newAnomalies;

    @Schema(description = "Units whose analysis threw and was skipped", example = "0")
    private int failedUnits;

    @Schema(description = "Run start, epoch millis")
    private long startedAt;

    @Schema(description = "Run duration in milliseconds", example = "184")
    private long durationMs;
}
