package com.solar.anomaly.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evidence behind a finding. {@code context} is an open key/value bag whose keys
 * are fixed per detector.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Structured evidence that produced an anomaly")
public class DetectionDetails {

    @Schema(description = "Detection method", example = "absolute_threshold")
    private String method;

    @Schema(description = "Expected value", example = "2500.0")
    private Double expectedValue;

    @Schema(description = "Observed value", example = "20.0")
    private Double actualValue;

    @Schema(description = "Deviation from expected, in percent", example = "100.0")
    private Double deviationPercent;

    @Schema(description = "Threshold that was crossed", example = "50.0")
    private Double threshold;

    @Schema(description = "Detector-specific evidence", example = "{\"systemCapacity\": 5000.0}")
    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();
}
