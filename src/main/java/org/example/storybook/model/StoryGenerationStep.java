package org.example.storybook.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.storybook.entity.StepStatus;

import java.time.LocalDateTime;

public record StoryGenerationStep(
        String runId,
        String stepName,
        StepStatus status,
        JsonNode detail,
        String errorMessage,
        LocalDateTime startedAt,
        LocalDateTime endedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public boolean isCompleted() {
        return status == StepStatus.COMPLETED;
    }
}
