package com.solar.anomaly.controller;

import com.solar.anomaly.exception.ResourceNotFoundException;
import com.solar.anomaly.exception.UpstreamUnavailableException;
import com.solar.anomaly.model.AnomalyType;
import com.solar.anomaly.model.DetectionRunResult;
import com.solar.anomaly.model.UnitDetectionResult;
import com.solar.anomaly.service.AnomalyDetectionJob;
import com.solar.anomaly.service.AnomalyDetectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.solar.anomaly.testutil.TestDataFactory.START;
import static com.solar.anomaly.testutil.TestDataFactory.createFinding;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DetectionController.class)
class DetectionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionJob detectionJob;

    @MockBean
    private AnomalyDetectionService detectionService;

    @Test
    void runDetection_returnsRunSummary() throws Exception {
        when(detectionJob.runDetectionJob()).thenReturn(DetectionRunResult.builder()
                .processed(3).anomaliesFound(2).newAnomalies(1).failedUnits(0)
                .startedAt(1000L).durationMs(25L)
                .build());

        mockMvc.perform(post("/api/v1/detection/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed").value(3))
                .andExpect(jsonPath("$.anomaliesFound").value(2))
                .andExpect(jsonPath("$.newAnomalies").value(1))
                .andExpect(jsonPath("$.failedUnits").value(0));
    }

    @Test
    void runDetection_directoryDownIsServiceUnavailable() throws Exception {
        when(detectionJob.runDetectionJob())
                .thenThrow(new UpstreamUnavailableException("Device directory unavailable", new RuntimeException()));

        mockMvc.perform(post("/api/v1/detection/run"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("UPSTREAM_UNAVAILABLE"));
    }

    @Test
    void detectForUnit_defaultsToFourteenDays() throws Exception {
        when(detectionService.detectForDevice("SU-1", 14)).thenReturn(new UnitDetectionResult(
                "SU-1", 14, 14, 1,
                List.of(createFinding("SU-1", AnomalyType.ZERO_PRODUCTION, START, START))));

        mockMvc.perform(post("/api/v1/detection/units/SU-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.windowDays").value(14))
                .andExpect(jsonPath("$.anomaliesDetected").value(1))
                .andExpect(jsonPath("$.anomalies[0].anomalyType").value("ZERO_PRODUCTION"))
                .andExpect(jsonPath("$.anomalies[0].severity").value("CRITICAL"));
    }

    @Test
    void detectForUnit_invalidWindowIsBadRequest() throws Exception {
        when(detectionService.detectForDevice("SU-1", 0))
                .thenThrow(new IllegalArgumentException("windowDays must be between 1 and 90, got 0"));

        mockMvc.perform(post("/api/v1/detection/units/SU-1?windowDays=0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void detectForUnit_nonNumericWindowIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/detection/units/SU-1?windowDays=abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void detectForUnit_unknownUnitIsNotFound() throws Exception {
        when(detectionService.detectForDevice("NOPE", 14)).thenThrow(new ResourceNotFoundException("Solar unit", "NOPE"));

        mockMvc.perform(post("/api/v1/detection/units/NOPE"))
                .andExpect(status().isNotFound());
    }
}
