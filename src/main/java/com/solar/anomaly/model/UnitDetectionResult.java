package com.solar.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Findings of an on-demand analysis of one unit (not persisted)")
public record UnitDetectionResult(
        @Schema(description = "Solar unit", example = "SU-0001") String unitId,
        @Schema(description = "Window length in days", example = "14") int windowDays,
        @Schema(description = "Number of daily aggregates analysed", example = "14") int daysAnalysed,
        @Schema(description = "Number of findings", example = "1") int anomaliesDetected,
        List<AnomalyFinding> anomalies) {}
