package org.example.storybook.model;

import org.example.storybook.entity.RunStatus;

import java.time.LocalDateTime;
import java.util.Map;

public record StoryGenerationRun(
        String runId,
        String storyId,
        String workflowExecution,
        RunStatus status,
        String currentStep,
        String errorMessage,
        Map<String, Object> metadata,
        LocalDateTime startedAt,
        LocalDateTime endedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
