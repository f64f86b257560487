package com.solar.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomaly rollups for reporting")
public class AnomalyStats {

    @Schema(description = "Counts per anomaly type", example = "{\"ZERO_PRODUCTION\": 3}")
    private Map<String, Long> byType;

    @Schema(description = "Counts per severity", example = "{\"CRITICAL\": 3, \"INFO\": 1}")
    private Map<String, Long> bySeverity;

    @Schema(description = "Counts per status", example = "{\"OPEN\": 2, \"RESOLVED\": 2}")
    private Map<String, Long> byStatus;

    @Schema(description = "Daily detections over the trend window, oldest first")
    private List<TrendPoint> recentTrend;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrendPoint {
        @Schema(example = "2026-10-05")
        private String date;
        private long total;
        private long critical;
        private long warning;
        private long info;
    }
}
