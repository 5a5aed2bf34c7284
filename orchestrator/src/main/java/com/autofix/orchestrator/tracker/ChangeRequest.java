package com.autofix.orchestrator.tracker;

/**
 * A pull request as seen by the coordinator.
 */
public record ChangeRequest(int number, String url, String headBranch) {}
