package com.autofix.orchestrator.pipeline;

import com.autofix.orchestrator.config.AutofixProperties;

import java.util.Objects;

/**
 * Immutable knobs of the state machine: how many fix-review rounds to allow
 * and how stage confidences are weighted.
 */
public record PipelineSettings(int maxIterations, ConfidenceWeights weights) {

    public static final PipelineSettings DEFAULT = new PipelineSettings(3, ConfidenceWeights.DEFAULT);

    public PipelineSettings {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
        }
        Objects.requireNonNull(weights, "weights");
    }

    public static PipelineSettings from(AutofixProperties.Pipeline pipeline) {
        return new PipelineSettings(pipeline.maxIterations(), ConfidenceWeights.of(pipeline.weights()));
    }
}
