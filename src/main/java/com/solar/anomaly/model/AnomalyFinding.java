package com.solar.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An anomaly candidate produced by a detector, not yet persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Anomaly candidate produced by a detector")
public class AnomalyFinding {

    @Schema(description = "Solar unit the finding applies to", example = "SU-0001")
    private String unitId;

    @Schema(description = "Anomaly type", example = "ZERO_PRODUCTION")
    private AnomalyType anomalyType;

    @Schema(description = "Affected calendar days")
    private AffectedPeriod affectedPeriod;

    @Schema(description = "Human-readable description generated from the evidence")
    private String description;

    @Schema(description = "Structured evidence")
    private DetectionDetails detectionDetails;

    @Schema(description = "Estimated energy lost in kWh, when computable", example = "2480.0")
    private Double estimatedEnergyLoss;

    public Severity getSeverity() {
        return anomalyType != null ? anomalyType.getSeverity() : null;
    }

    public String getRecommendedAction() {
        return anomalyType != null ? anomalyType.getRecommendedAction() : null;
    }
}
