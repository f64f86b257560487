package com.solar.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Operator action on an anomaly")
public record StatusChangeRequest(
        @Schema(description = "Acting operator id, defaults to \"operator\"", example = "ops-alice") String actor,
        @Schema(description = "Resolution notes, ignored on acknowledge", example = "Inverter replaced") String notes) {}
