package org.example.storybook.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * One end-to-end generation attempt for a story.
 * <p>
 * {@code activeStoryId} mirrors {@code storyId} while the run is queued or running and is cleared
 * once the run reaches a terminal status. Its unique constraint keeps at most one active run per story.
 */
@Entity
@Table(name = "story_generation_runs", indexes = {
        @Index(name = "idx_story_generation_runs_story", columnList = "story_id")
})
public class StoryGenerationRunEntity implements Persistable<String> {

    @Id
    @Column(name = "run_id", length = 64)
    private String runId;

    @Column(name = "story_id", nullable = false, length = 64)
    private String storyId;

    @Column(name = "active_story_id", length = 64, unique = true)
    private String activeStoryId;

    @Column(name = "workflow_execution", length = 255)
    private String workflowExecution;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "current_step", length = 120)
    private String currentStep;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "metadata_json", columnDefinition = "TEXT")
    private String metadataJson;

    @Column
    private LocalDateTime startedAt;

    @Column
    private LocalDateTime endedAt;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public StoryGenerationRunEntity() {
    }

    public StoryGenerationRunEntity(String runId, String storyId) {
        this.runId = runId;
        this.storyId = storyId;
        this.status = RunStatus.QUEUED;
    }

    @PrePersist
    @PreUpdate
    public void updateTimestamps() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        if (status == null) {
            status = RunStatus.QUEUED;
        }
        activeStoryId = status.isActive() ? storyId : null;
    }

    @Override
    public String getId() { return runId; }

    // run ids may be supplied by the caller, so a missing createdAt marks an unsaved row
    @Override
    public boolean isNew() { return createdAt == null; }

    public String getRunId() { return runId; }
    public void setRunId(String runId) { this.runId = runId; }

    public String getStoryId() { return storyId; }
    public void setStoryId(String storyId) { this.storyId = storyId; }

    public String getActiveStoryId() { return activeStoryId; }

    public String getWorkflowExecution() { return workflowExecution; }
    public void setWorkflowExecution(String workflowExecution) { this.workflowExecution = workflowExecution; }

    public RunStatus getStatus() { return status; }
    public void setStatus(RunStatus status) { this.status = status; }

    public String getCurrentStep() { return currentStep; }
    public void setCurrentStep(String currentStep) { this.currentStep = currentStep; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public String getMetadataJson() { return metadataJson; }
    public void setMetadataJson(String metadataJson) { this.metadataJson = metadataJson; }

    public LocalDateTime getStartedAt() { return startedAt; }
    public void setStartedAt(LocalDateTime startedAt) { this.startedAt = startedAt; }

    public LocalDateTime getEndedAt() { return endedAt; }
    public void setEndedAt(LocalDateTime endedAt) { this.endedAt = endedAt; }

    public LocalDateTime getCreatedAt() { return createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
