package org.example.storybook.service.workflow;

import org.example.storybook.model.ConversationContext;
import org.example.storybook.model.ProgressCalculation;
import org.example.storybook.model.RunUpdate;
import org.example.storybook.model.StepName;
import org.example.storybook.model.StepResult;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.service.ConversationContextManager;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.RunLedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Terminal transitions of a run: completion after the last step, or failure reported by the workflow.
 */
@Service
public class RunCompletionService {

    private static final Logger log = LoggerFactory.getLogger(RunCompletionService.class);

    private final RunLedgerService runLedgerService;
    private final ConversationContextManager contextManager;
    private final ProgressTrackerService progressTracker;

    public RunCompletionService(
            RunLedgerService runLedgerService,
            ConversationContextManager contextManager,
            ProgressTrackerService progressTracker) {
        this.runLedgerService = runLedgerService;
        this.contextManager = contextManager;
        this.progressTracker = progressTracker;
    }

    /**
     * Records the {@code done} marker, completes the run, drops its conversation and publishes the story.
     */
    public CompletionResult complete(StepTrigger trigger) {
        StoryGenerationRun run = runLedgerService.createOrGetRun(
                trigger.storyId(), trigger.workflowId(), trigger.workflowExecution());
        AbstractStepHandler.requireNotCancelled(run);
        String done = StepName.DONE.format();

        runLedgerService.storeStepResult(run.runId(), done,
                StepResult.completed(Map.of("completedAt", LocalDateTime.now().toString())));
        StoryGenerationRun completed = runLedgerService.updateRun(run.runId(), RunUpdate.completed(done));
        clearContext(completed);

        progressTracker.refreshQuietly(completed.runId());
        ProgressCalculation progress = progressTracker.calculateProgress(completed.runId());
        log.info("Run {} for story {} completed", completed.runId(), completed.storyId());
        return new CompletionResult(completed.runId(), completed.status(), completed.currentStep(),
                progress.completedPercentage());
    }

    public StoryGenerationRun failRun(String runId, String errorMessage) {
        String message = errorMessage != null && !errorMessage.isBlank() ? errorMessage : "Workflow reported failure";
        StoryGenerationRun failed = runLedgerService.updateRun(runId, RunUpdate.failed(message));
        log.warn("Run {} for story {} marked failed: {}", runId, failed.storyId(), message);
        return failed;
    }

    private void clearContext(StoryGenerationRun run) {
        String contextId = ConversationContext.contextIdFor(run.storyId(), run.runId());
        try {
            contextManager.clearContext(contextId);
        } catch (RuntimeException e) {
            log.warn("Could not clear conversation context {}; it will expire with the stale-context cleanup",
                    contextId, e);
        }
    }
}
