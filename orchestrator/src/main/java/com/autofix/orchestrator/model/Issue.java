package com.autofix.orchestrator.model;

import java.util.List;

/**
 * An issue-tracker bug report. Read-only input to the pipeline.
 */
public record Issue(
        int number,
        String title,
        String body,
        List<String> labels,
        String url) {

    public Issue {
        body   = body == null ? "" : body;
        labels = labels == null ? List.of() : List.copyOf(labels);
        url    = url == null ? "" : url;
    }
}
