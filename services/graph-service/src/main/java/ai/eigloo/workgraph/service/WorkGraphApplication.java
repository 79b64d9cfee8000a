package ai.eigloo.workgraph.service;

import ai.eigloo.workgraph.service.config.WorkGraphProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Main Spring Boot application class for the WorkGraph service.
 *
 * This service is responsible for:
 * - Holding the dependency graph index over PostgreSQL storage
 * - Exposing the engine services (containment, hierarchy, pour, workflow lifecycle) as beans
 * - Publishing audit events for committed mutations to Kafka
 */
@SpringBootApplication
@EntityScan(basePackages = "ai.eigloo.workgraph.graph.entity")
@EnableJpaRepositories(basePackages = "ai.eigloo.workgraph.graph.repository")
@EnableConfigurationProperties(WorkGraphProperties.class)
public class WorkGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkGraphApplication.class, args);
    }
}
