package com.z254.butterfly.scout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SCOUT - Repository Audit Coordination for the BUTTERFLY Ecosystem.
 *
 * <p>SCOUT provides:
 * <ul>
 *   <li>Agent Orchestrator - dependency-driven scheduling of audit agents with bounded concurrency</li>
 *   <li>Shared Context - hierarchical key/value store with prefix watches</li>
 *   <li>Message Broker - point-to-point and topic broadcast messaging between agents</li>
 *   <li>Audit Pipeline - cloning, security analysis, code review and reporting agents</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class ScoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScoutApplication.class, args);
    }
}
