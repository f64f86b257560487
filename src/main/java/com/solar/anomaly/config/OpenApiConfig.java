package com.solar.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI solarAnomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Solar Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Batch anomaly detection over daily energy production of solar units.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. List ACTIVE solar units\n" +
                                "2. Sum energy readings per calendar day over a trailing window (default 14 days)\n" +
                                "3. Run every registered detector against the daily series\n" +
                                "4. Store each new finding as an OPEN anomaly (deduplicated per unit, type and period)\n\n" +
                                "**Anomaly Types:**\n" +
                                "- `ZERO_PRODUCTION` (CRITICAL): a day at or below 1% of capacity\n" +
                                "- `SIGNIFICANT_DROP` (WARNING): a day more than 50% below the window mean\n" +
                                "- `GRADUAL_DEGRADATION` (WARNING): negative regression slope, >15% decline over the window\n" +
                                "- `SENSOR_SPIKE` (INFO): a day above 1.5x the physical maximum\n" +
                                "- `INTERMITTENT_FAILURE` (WARNING): repeated near-zero days with recovery in between\n" +
                                "- `BELOW_THRESHOLD` (INFO): most producing days below 20% of the expected baseline\n\n" +
                                "**Lifecycle:** OPEN → ACKNOWLEDGED → RESOLVED, or OPEN/ACKNOWLEDGED → FALSE_POSITIVE")
                        .contact(new Contact().name("Solar Monitoring Team")));
    }
}
