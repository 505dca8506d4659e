package com.chimera.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Chimera workflow engine.
 *
 * Starts the durable task queue, the executor pool (auto-start controlled by
 * chimera.pool.auto-start) and the HTTP wrapper around enqueue and metrics.
 *
 * To run against a local Postgres:
 *   DB_URL=jdbc:postgresql://localhost:5432/chimera mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
