package com.solar.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SolarAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(SolarAnomalyDetectionApplication.class, args);
    }
}
