package com.autofix.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Runs the issue numbers given on the command line through the fix pipeline
 * and exits with the batch result.
 *
 * To run:
 *   AUTOFIX_PROJECT_DIR=/path/to/clone AUTOFIX_GITHUB_REPO=owner/name \
 *     java -jar orchestrator.jar 1234 5678
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OrchestratorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(OrchestratorApplication.class, args)));
    }

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
