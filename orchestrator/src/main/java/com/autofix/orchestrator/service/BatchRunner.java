package com.autofix.orchestrator.service;

import com.autofix.orchestrator.config.AutofixProperties;
import com.autofix.orchestrator.model.PipelineStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of a run: processes the issue numbers given on the command line,
 * one after another.
 *
 * Option arguments ({@code --name=value}) are Spring properties and are
 * ignored here. The exit code is 0 when no issue failed, 1 otherwise, and 2
 * when the arguments name no issue at all.
 */
@Component
public class BatchRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final RunCoordinator    coordinator;
    private final AutofixProperties properties;

    private int exitCode;

    public BatchRunner(RunCoordinator coordinator, AutofixProperties properties) {
        this.coordinator = coordinator;
        this.properties  = properties;
    }

    @Override
    public void run(String... args) {
        List<Integer> issues = new ArrayList<>();
        for (String arg : args) {
            if (arg.startsWith("--")) {
                continue;
            }
            try {
                issues.add(Integer.parseInt(arg.strip()));
            } catch (NumberFormatException e) {
                log.error("Not an issue number: '{}'", arg);
                exitCode = 2;
                return;
            }
        }
        if (issues.isEmpty()) {
            log.warn("No issue numbers given. Usage: orchestrator <issue-number>...");
            exitCode = 2;
            return;
        }

        log.info("Repository: {}, project: {}, issues to process: {}",
                properties.githubRepo(), properties.projectDir(), issues.size());

        Summary summary = runAll(issues);
        summary.log();
        exitCode = summary.failed().isEmpty() ? 0 : 1;
    }

    Summary runAll(List<Integer> issues) {
        Summary summary = new Summary(new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
        for (int i = 0; i < issues.size(); i++) {
            int number = issues.get(i);
            log.info("Issue #{} ({}/{})", number, i + 1, issues.size());

            PipelineStatus result;
            try {
                result = coordinator.process(number);
            } catch (RuntimeException e) {
                log.error("Unexpected error processing #{}", number, e);
                result = PipelineStatus.FAILED;
            }

            switch (result) {
                case SUCCESS -> summary.succeeded().add(number);
                case SKIPPED -> summary.skipped().add(number);
                default      -> summary.failed().add(number);
            }
        }
        return summary;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** Issue numbers by outcome, in processing order. */
    record Summary(List<Integer> succeeded, List<Integer> skipped, List<Integer> failed) {

        void log() {
            if (!succeeded.isEmpty()) {
                log.info("Completed ({}): {}", succeeded.size(), succeeded);
            }
            if (!skipped.isEmpty()) {
                log.warn("Skipped ({}): {}", skipped.size(), skipped);
            }
            if (!failed.isEmpty()) {
                log.error("Failed ({}): {}", failed.size(), failed);
            }
            log.info("Total: {} issues processed", succeeded.size() + skipped.size() + failed.size());
        }
    }
}
