package com.solar.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A monitored solar generation unit")
public class SolarUnit {

    @Schema(description = "Unit identifier", example = "SU-0001")
    private String unitId;

    @Schema(description = "Manufacturer serial number", example = "SN-2024-000123")
    private String serialNumber;

    @Schema(description = "Rated capacity in watts", example = "5000")
    private double capacityWatts;

    @Schema(description = "Operational status; only ACTIVE units are analysed", example = "ACTIVE")
    private SolarUnitStatus status;

    @Schema(description = "Installation date", example = "2024-03-15")
    private LocalDate installationDate;
}
