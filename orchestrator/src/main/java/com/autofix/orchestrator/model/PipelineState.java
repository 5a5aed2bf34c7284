package com.autofix.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running state of one pipeline run. This is the document written to
 * {@code pipeline.state.json} after every transition.
 *
 * Only the pipeline state machine mutates it. Invariants:
 *   - completedAt is set if and only if the status is terminal
 *   - aggregateConfidence is set if and only if the status is SUCCESS
 *   - once terminal, no further mutation is accepted
 */
public class PipelineState {

    private final int issueNumber;
    private final Instant startedAt;

    private PipelineStatus status = PipelineStatus.RUNNING;
    private String currentAgent;
    private final List<String> agentsCompleted = new ArrayList<>();
    private String failureReason;
    private Double aggregateConfidence;
    private Map<String, Double> confidenceBreakdown = Map.of();
    private final Map<String, AgentState> agentStates = new LinkedHashMap<>();
    private Instant completedAt;

    public PipelineState(int issueNumber, Instant startedAt) {
        this.issueNumber = issueNumber;
        this.startedAt   = startedAt;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void setCurrentAgent(String currentAgent) {
        requireRunning();
        this.currentAgent = currentAgent;
    }

    /** Append a marker such as "fix", "triage:skipped" or "fix-revision-2". */
    public void recordStage(String marker) {
        requireRunning();
        agentsCompleted.add(marker);
    }

    /** Latest result for a role, keyed by role key; a revision replaces the earlier fix. */
    public void putAgentState(String role, AgentState agentState) {
        requireRunning();
        agentStates.put(role, agentState);
    }

    /** Terminate with SKIPPED, FAILED or BLOCKED. */
    public void finish(PipelineStatus terminal, String reason, Instant at) {
        requireRunning();
        if (terminal == PipelineStatus.RUNNING || terminal == PipelineStatus.SUCCESS) {
            throw new IllegalArgumentException("finish() needs a non-success terminal status, got " + terminal);
        }
        this.status        = terminal;
        this.failureReason = reason;
        this.completedAt   = at;
    }

    /** Terminate with SUCCESS; the only way the aggregate confidence is ever set. */
    public void succeed(double aggregate, Map<String, Double> breakdown, Instant at) {
        requireRunning();
        this.status              = PipelineStatus.SUCCESS;
        this.aggregateConfidence = aggregate;
        this.confidenceBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        this.completedAt         = at;
    }

    private void requireRunning() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Pipeline for issue #" + issueNumber + " is already " + status);
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public PipelineStatus       getStatus()              { return status; }
    public int                  getIssueNumber()         { return issueNumber; }
    public String               getCurrentAgent()        { return currentAgent; }
    public List<String>         getAgentsCompleted()     { return Collections.unmodifiableList(agentsCompleted); }
    public String               getFailureReason()       { return failureReason; }
    public Double               getAggregateConfidence() { return aggregateConfidence; }
    public Map<String, Double>  getConfidenceBreakdown() { return confidenceBreakdown; }
    public Map<String, AgentState> getAgentStates()      { return Collections.unmodifiableMap(agentStates); }
    public Instant              getStartedAt()           { return startedAt; }
    public Instant              getCompletedAt()         { return completedAt; }

    /** Elapsed seconds; measured up to now while the run is still going. */
    public double getDurationSeconds() {
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(startedAt, end).toMillis() / 1000.0;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
