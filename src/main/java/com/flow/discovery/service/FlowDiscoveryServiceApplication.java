package com.flow.discovery.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Flow Discovery Service Application - Entry point for the Spring Boot application.
 *
 * This application discovers process models from event logs. It:
 * - Accepts parsed event logs (traces or trace variants with frequencies)
 * - Mines a process tree with the selected Inductive Miner variant
 * - Returns the tree together with per-activity frequencies and display sizes
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.flow.discovery.service.config")
public class FlowDiscoveryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowDiscoveryServiceApplication.class, args);
    }
}
