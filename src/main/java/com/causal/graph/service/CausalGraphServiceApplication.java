package com.causal.graph.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Causal Graph Service Application - Entry point for the Spring Boot application.
 *
 * Ingests literature-derived causal graphs and reduces them stage by stage:
 * - ranks and prunes generic hub nodes
 * - enumerates feedback cycles inside strongly connected components
 * - classifies confounders of the exposure/outcome pair and breaks their feedback
 * - flags confounders whose adjustment would open a butterfly collider path
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.causal.graph.service.config")
public class CausalGraphServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CausalGraphServiceApplication.class, args);
    }
}
