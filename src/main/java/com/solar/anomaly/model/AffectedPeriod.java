package com.solar.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;
import java.util.Objects;

@Schema(description = "Inclusive calendar-day range affected by an anomaly")
public record AffectedPeriod(
        @Schema(description = "First affected day", example = "2026-10-05") LocalDate startDate,
        @Schema(description = "Last affected day", example = "2026-10-05") LocalDate endDate) {

    public AffectedPeriod {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException(
                    "Affected period start " + startDate + " is after end " + endDate);
        }
    }

    public static AffectedPeriod singleDay(LocalDate date) {
        return new AffectedPeriod(date, date);
    }
}
