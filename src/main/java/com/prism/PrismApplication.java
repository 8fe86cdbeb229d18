package com.prism;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Prism.
 *
 * Prism compiles declarative analytical query descriptions (granularity,
 * time range, group-by columns, metrics, filters, row and series limits)
 * into SQL for the configured database engine and runs them.
 *
 * Key Features:
 * - Time series with engine-specific time grain truncation
 * - Top-N series limiting through a ranked inner query
 * - Epoch and engine-specific date/time literal rendering
 * - Raw SQL datasources with template expansion
 */
@SpringBootApplication
public class PrismApplication {

    /**
     * Main entry point for the Prism application.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(PrismApplication.class, args);
    }
}
