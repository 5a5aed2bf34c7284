package com.autofix.orchestrator.store;

import com.autofix.orchestrator.model.AgentState;
import com.autofix.orchestrator.model.Issue;
import com.autofix.orchestrator.model.PipelineState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One pipeline run's directory: the durable snapshot plus write-once audit
 * artifacts.
 *
 * Layout:
 * <pre>
 *   issue.json                      issue as fetched at run start
 *   pipeline.state.json             current PipelineState, overwritten per transition
 *   {stage}.state.json              AgentState of each completed stage
 *   {stage}.prompt.md / {stage}.log rendered prompt and raw agent output
 *   fix-revision-{n}.*              the same three artifacts per revision
 * </pre>
 *
 * Every JSON document is written to a temp file and moved into place, so a
 * reader polling the directory only ever sees complete documents.
 */
public class RunDirectory {

    private static final Logger log = LoggerFactory.getLogger(RunDirectory.class);

    private static final DateTimeFormatter DIR_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    static final String PIPELINE_STATE = "pipeline.state.json";
    static final String ISSUE          = "issue.json";

    private final Path         dir;
    private final ObjectMapper json;

    public RunDirectory(Path dir, ObjectMapper objectMapper) {
        this.dir  = dir;
        this.json = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Create {@code <runsDir>/<yyyy-MM-dd_HH-mm-ss>-issue-<n>}.
     */
    public static RunDirectory create(Path runsDir, int issueNumber, Clock clock, ObjectMapper objectMapper) {
        String name = LocalDateTime.now(clock).format(DIR_STAMP) + "-issue-" + issueNumber;
        Path dir = runsDir.resolve(name);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StateStoreException("Could not create run directory " + dir, e);
        }
        log.info("Run directory: {}", dir);
        return new RunDirectory(dir, objectMapper);
    }

    public Path path() {
        return dir;
    }

    // ------------------------------------------------------------------
    // Artifact paths
    // ------------------------------------------------------------------

    public Path stateFile(String label)  { return dir.resolve(label + ".state.json"); }
    public Path promptFile(String label) { return dir.resolve(label + ".prompt.md"); }
    public Path logFile(String label)    { return dir.resolve(label + ".log"); }
    public Path pipelineStateFile()      { return dir.resolve(PIPELINE_STATE); }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    public void writeIssue(Issue issue) {
        writeJson(dir.resolve(ISSUE), issue);
    }

    /** Overwrite the pipeline snapshot in full. */
    public void writePipelineState(PipelineState state) {
        writeJson(pipelineStateFile(), state);
    }

    public void writeAgentState(String label, AgentState state) {
        writeJson(stateFile(label), state);
    }

    public void writePrompt(String label, String prompt) {
        writeAtomically(promptFile(label), prompt);
    }

    private void writeJson(Path target, Object value) {
        String text;
        try {
            text = json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Could not serialise " + target.getFileName(), e);
        }
        writeAtomically(target, text + "\n");
    }

    private void writeAtomically(Path target, String content) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateStoreException("Could not write " + target, e);
        }
    }
}
