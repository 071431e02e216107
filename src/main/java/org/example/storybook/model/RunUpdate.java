package org.example.storybook.model;

import org.example.storybook.entity.RunStatus;

import java.util.Map;

/**
 * Partial update for a run; null fields are left unchanged and metadata is merged key by key.
 */
public record RunUpdate(
        RunStatus status,
        String currentStep,
        String errorMessage,
        Map<String, Object> metadata
) {

    public static RunUpdate running(String currentStep) {
        return new RunUpdate(RunStatus.RUNNING, currentStep, null, null);
    }

    public static RunUpdate failed(String errorMessage) {
        return new RunUpdate(RunStatus.FAILED, null, errorMessage, null);
    }

    public static RunUpdate completed(String currentStep) {
        return new RunUpdate(RunStatus.COMPLETED, currentStep, null, null);
    }

    public static RunUpdate status(RunStatus status) {
        return new RunUpdate(status, null, null, null);
    }

    public RunUpdate withMetadata(Map<String, Object> metadata) {
        return new RunUpdate(status, currentStep, errorMessage, metadata);
    }
}
