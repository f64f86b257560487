package com.solar.anomaly.controller;

import com.solar.anomaly.model.Anomaly;
import com.solar.anomaly.model.AnomalyFilter;
import com.solar.anomaly.model.AnomalyPage;
import com.solar.anomaly.model.AnomalyStats;
import com.solar.anomaly.model.AnomalyStatus;
import com.solar.anomaly.model.AnomalyType;
import com.solar.anomaly.model.Severity;
import com.solar.anomaly.model.StatusChangeRequest;
import com.solar.anomaly.service.AnomalyQueryService;
import com.solar.anomaly.service.AnomalyResolutionService;
import com.solar.anomaly.service.AnomalyStatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Query, review and resolve detected anomalies")
public class AnomalyController {

    private final AnomalyQueryService queryService;
    private final AnomalyResolutionService resolutionService;
    private final AnomalyStatisticsService statisticsService;

    public AnomalyController(AnomalyQueryService queryService,
                             AnomalyResolutionService resolutionService,
                             AnomalyStatisticsService statisticsService) {
        this.queryService = queryService;
        this.resolutionService = resolutionService;
        this.statisticsService = statisticsService;
    }

    @GetMapping
    @Operation(summary = "List anomalies",
               description = "All anomalies, newest detection first, with optional filters and paging")
    public ResponseEntity<AnomalyPage> listAll(
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String status,
            @Parameter(description = "Page size (max 500)") @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        AnomalyFilter filter = filter(null, type, severity, status, limit, offset);
        return ResponseEntity.ok(queryService.listAll(filter));
    }

    @GetMapping("/units/{unitId}")
    @Operation(summary = "List anomalies of a unit",
               description = "Anomalies of one solar unit, newest detection first")
    public ResponseEntity<List<Anomaly>> listForUnit(
            @PathVariable String unitId,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "100") int limit) {
        AnomalyFilter filter = filter(unitId, type, severity, status, limit, 0);
        return ResponseEntity.ok(queryService.listForDevice(unitId, filter));
    }

    @GetMapping("/stats")
    @Operation(summary = "Anomaly statistics",
               description = "Counts by type, severity and status plus a daily detection trend. " +
                       "Restricted to one unit when unitId is given.")
    public ResponseEntity<AnomalyStats> stats(@RequestParam(required = false) String unitId) {
        return ResponseEntity.ok(statisticsService.stats(unitId));
    }

    @GetMapping("/types")
    @Operation(summary = "Anomaly types",
               description = "Every anomaly type with its severity and recommended action, plus the known statuses")
    public ResponseEntity<Map<String, Object>> types() {
        List<Map<String, Object>> types = new ArrayList<>();
        for (AnomalyType type : AnomalyType.values()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("type", type.name());
            info.put("severity", type.getSeverity().name());
            info.put("lossEstimable", type.isLossEstimable());
            info.put("recommendedAction", type.getRecommendedAction());
            types.add(info);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("types", types);
        response.put("severities", Arrays.stream(Severity.values()).map(Enum::name).toList());
        response.put("statuses", Arrays.stream(AnomalyStatus.values()).map(Enum::name).toList());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{anomalyId}")
    @Operation(summary = "Get an anomaly")
    public ResponseEntity<Anomaly> getById(@PathVariable String anomalyId) {
        return ResponseEntity.ok(queryService.getById(anomalyId));
    }

    @PostMapping("/{anomalyId}/acknowledge")
    @Operation(summary = "Acknowledge an anomaly", description = "Only allowed while the anomaly is OPEN")
    public ResponseEntity<Anomaly> acknowledge(@PathVariable String anomalyId,
                                               @RequestBody(required = false) StatusChangeRequest body) {
        return ResponseEntity.ok(resolutionService.acknowledge(anomalyId, actor(body)));
    }

    @PostMapping("/{anomalyId}/resolve")
    @Operation(summary = "Resolve an anomaly", description = "Allowed from OPEN or ACKNOWLEDGED")
    public ResponseEntity<Anomaly> resolve(@PathVariable String anomalyId,
                                           @RequestBody(required = false) StatusChangeRequest body) {
        return ResponseEntity.ok(resolutionService.resolve(anomalyId, actor(body), notes(body)));
    }

    @PostMapping("/{anomalyId}/false-positive")
    @Operation(summary = "Mark an anomaly as a false positive", description = "Allowed from OPEN or ACKNOWLEDGED")
    public ResponseEntity<Anomaly> markFalsePositive(@PathVariable String anomalyId,
                                                     @RequestBody(required = false) StatusChangeRequest body) {
        return ResponseEntity.ok(resolutionService.markFalsePositive(anomalyId, actor(body), notes(body)));
    }

    private static AnomalyFilter filter(String unitId, String type, String severity, String status,
                                        int limit, int offset) {
        return new AnomalyFilter(unitId,
                parse(AnomalyType.class, type, "type"),
                parse(Severity.class, severity, "severity"),
                parse(AnomalyStatus.class, status, "status"),
                limit, offset);
    }

    private static <E extends Enum<E>> E parse(Class<E> enumType, String value, String name) {
        if (value == null || value.isBlank()) return null;
        try {
            return Enum.valueOf(enumType, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + name + ": " + value, e);
        }
    }

    private static String actor(StatusChangeRequest body) {
        return body != null ? body.actor() : null;
    }

    private static String notes(StatusChangeRequest body) {
        return body != null ? body.notes() : null;
    }
}
