package com.iotwatch.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;


/**
 * Spring Boot application hosting the telemetry anomaly pipeline.
 */
@SpringBootApplication
@EnableScheduling
public class AnomalyStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyStreamApplication.class, args);
    }
}
