package com.solar.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A stored, lifecycle-tracked anomaly")
public class Anomaly {

    @Schema(description = "Anomaly identifier, derived from unit, type and affected period",
            example = "3f1c2a4e-8d2b-3c55-9a0e-1b2c3d4e5f60")
    private String anomalyId;

    @Schema(description = "Solar unit", example = "SU-0001")
    private String unitId;

    @Schema(description = "Anomaly type", example = "ZERO_PRODUCTION")
    private AnomalyType anomalyType;

    @Schema(description = "Severity, fixed by the anomaly type", example = "CRITICAL")
    private Severity severity;

    @Schema(description = "Affected calendar days")
    private AffectedPeriod affectedPeriod;

    @Schema(description = "Human-readable description")
    private String description;

    @Schema(description = "Structured evidence")
    private DetectionDetails detectionDetails;

    @Schema(description = "Resolution status", example = "OPEN")
    private AnomalyStatus status;

    @Schema(description = "Recommended operator action")
    private String recommendedAction;

    @Schema(description = "Estimated energy lost in kWh, when computable", example = "2480.0")
    private Double estimatedEnergyLoss;

    private long detectedAt;
    private long acknowledgedAt;        // 0 until acknowledged
    private String acknowledgedBy;
    private long resolvedAt;            // 0 until resolved or marked false positive
    private String resolvedBy;
    private String resolutionNotes;
    private long createdAt;
    private long updatedAt;

    public boolean isActive() {
        return status != null && status.isActive();
    }

    /**
     * Build a new OPEN anomaly from a detector finding.
     */
    public static Anomaly fromFinding(AnomalyFinding finding, long now) {
        AffectedPeriod period = finding.getAffectedPeriod();
        return Anomaly.builder()
                .anomalyId(idFor(finding.getUnitId(), finding.getAnomalyType(),
                        period.startDate(), period.endDate()))
                .unitId(finding.getUnitId())
                .anomalyType(finding.getAnomalyType())
                .severity(finding.getAnomalyType().getSeverity())
                .affectedPeriod(period)
                .description(finding.getDescription())
                .detectionDetails(finding.getDetectionDetails())
                .status(AnomalyStatus.OPEN)
                .recommendedAction(finding.getAnomalyType().getRecommendedAction())
                .estimatedEnergyLoss(finding.getEstimatedEnergyLoss())
                .detectedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Deterministic id for the dedup key (unit, type, start, end). Equivalent
     * findings always map to the same storage key.
     */
    public static String idFor(String unitId, AnomalyType type, LocalDate startDate, LocalDate endDate) {
        String dedupKey = unitId + "|" + type.name() + "|" + startDate + "|" + endDate;
        return UUID.nameUUIDFromBytes(dedupKey.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
