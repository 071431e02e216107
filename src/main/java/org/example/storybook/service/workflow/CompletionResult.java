package org.example.storybook.service.workflow;

import org.example.storybook.entity.RunStatus;

public record CompletionResult(
        String runId,
        RunStatus status,
        String currentStep,
        int completedPercentage
) {
}
