package com.solar.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.mockito.Mockito;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so that consumers are protected
 * from accidental endpoint or schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    /**
     * Replaces the cluster connection so the context starts without a server.
     */
    @TestConfiguration
    static class StoreStubs {

        @Bean
        AerospikeClient aerospikeClient() {
            return Mockito.mock(AerospikeClient.class);
        }

        @Bean("aerospikeNamespace")
        String aerospikeNamespace() {
            return "contract";
        }

        @Bean
        WritePolicy defaultWritePolicy() {
            return new WritePolicy();
        }

        @Bean
        Policy defaultReadPolicy() {
            return new Policy();
        }
    }

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = apiDocs();
        Map<String, Object> paths = json.read("$.paths");

        // Detection
        assertThat(paths).containsKey("/api/v1/detection/run");
        assertThat(paths).containsKey("/api/v1/detection/units/{unitId}");

        // Anomalies
        assertThat(paths).containsKey("/api/v1/anomalies");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/acknowledge");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/resolve");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/false-positive");
        assertThat(paths).containsKey("/api/v1/anomalies/units/{unitId}");
        assertThat(paths).containsKey("/api/v1/anomalies/stats");
        assertThat(paths).containsKey("/api/v1/anomalies/types");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("Anomaly");
        assertThat(schemas).containsKey("AnomalyFinding");
        assertThat(schemas).containsKey("DetectionRunResult");
        assertThat(schemas).containsKey("UnitDetectionResult");
        assertThat(schemas).containsKey("AnomalyStats");
        assertThat(schemas).containsKey("StatusChangeRequest");
    }

    @Test
    void openApiSpec_anomalySchema_hasLifecycleFields() {
        Map<String, Object> props = apiDocs().read("$.components.schemas.Anomaly.properties");

        assertThat(props).containsKey("anomalyId");
        assertThat(props).containsKey("unitId");
        assertThat(props).containsKey("anomalyType");
        assertThat(props).containsKey("severity");
        assertThat(props).containsKey("affectedPeriod");
        assertThat(props).containsKey("detectionDetails");
        assertThat(props).containsKey("status");
        assertThat(props).containsKey("detectedAt");
        assertThat(props).containsKey("resolvedBy");
    }

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        return JsonPath.parse(response.getBody());
    }
}
