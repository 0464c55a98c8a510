package com.behaviorguard.detector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Behavior Guard Detection Engine.
 *
 * <p>
 * Spring Boot application that ingests per-process OS telemetry events,
 * keeps bounded behavioral history for every live process, fuses a trained
 * classifier with heuristic indicators into a verdict, and drives evidence
 * capture, process termination and alerting for malicious processes.
 * </p>
 */
@SpringBootApplication
@EnableScheduling
public class BehaviorGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(BehaviorGuardApplication.class, args);
    }
}
