package com.dcruver.clausedrift;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Clause Drift.
 *
 * Compares consecutive versions of a contract clause by clause, detects what
 * was added, removed, modified or rewritten, and classifies the risk of each
 * change. The language model is optional; every result has a rule-based path.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class ClauseDriftApplication {

    public static void main(String[] args) {
        log.info("Starting Clause Drift...");
        SpringApplication.run(ClauseDriftApplication.class, args);
    }
}
