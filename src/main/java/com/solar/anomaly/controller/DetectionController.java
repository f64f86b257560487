package com.solar.anomaly.controller;

import com.solar.anomaly.model.DetectionRunResult;
import com.solar.anomaly.model.UnitDetectionResult;
import com.solar.anomaly.service.AnomalyDetectionJob;
import com.solar.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/detection")
@Tag(name = "Detection", description = "Batch and on-demand anomaly detection over daily energy production")
public class DetectionController {

    private final AnomalyDetectionJob detectionJob;
    private final AnomalyDetectionService detectionService;

    public DetectionController(AnomalyDetectionJob detectionJob,
                               AnomalyDetectionService detectionService) {
        this.detectionJob = detectionJob;
        this.detectionService = detectionService;
    }

    @PostMapping("/run")
    @Operation(summary = "Run detection over all active units",
               description = "Analyses the trailing window of every active unit and stores new anomalies. " +
                       "Safe to repeat: equivalent anomalies are never stored twice.")
    public ResponseEntity<DetectionRunResult> runDetection() {
        return ResponseEntity.ok(detectionJob.runDetectionJob());
    }

    @PostMapping("/units/{unitId}")
    @Operation(summary = "Analyse one unit without storing results",
               description = "Runs every detector over the unit's last windowDays days and returns the findings")
    public ResponseEntity<UnitDetectionResult> detectForUnit(
            @PathVariable String unitId,
            @Parameter(description = "Window length in days (1-90)")
            @RequestParam(defaultValue = "14") int windowDays) {
        return ResponseEntity.ok(detectionService.detectForDevice(unitId, windowDays));
    }
}
