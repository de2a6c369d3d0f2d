package com.maintenance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Machine Feature Pipeline.
 * This service ingests machine telemetry, periodically recomputes per-machine
 * maintenance features and serves the latest values.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class MachineFeaturePipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MachineFeaturePipelineApplication.class, args);
    }
}
