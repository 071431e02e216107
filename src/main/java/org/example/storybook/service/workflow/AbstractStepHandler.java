package org.example.storybook.service.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.storybook.entity.RunStatus;
import org.example.storybook.model.BookOutline;
import org.example.storybook.model.RunUpdate;
import org.example.storybook.model.StepName;
import org.example.storybook.model.StepResult;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.model.StoryGenerationStep;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.RunLedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Function;

/**
 * Shared lifecycle of a workflow step: resolve the run, mark it running, do the work, record the
 * result, then refresh the story's progress.
 * <p>
 * A failure of the work or of the result write records the step as failed, fails the run with the
 * error message and is rethrown. Progress refresh failures are only logged.
 */
public abstract class AbstractStepHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractStepHandler.class);

    @FunctionalInterface
    protected interface StepWork<T> {
        T execute(StoryGenerationRun run);
    }

    protected final RunLedgerService runLedgerService;
    protected final ProgressTrackerService progressTracker;
    protected final OutlineParser outlineParser;

    protected AbstractStepHandler(
            RunLedgerService runLedgerService,
            ProgressTrackerService progressTracker,
            OutlineParser outlineParser) {
        this.runLedgerService = runLedgerService;
        this.progressTracker = progressTracker;
        this.outlineParser = outlineParser;
    }

    protected <T> T runStep(StepTrigger trigger, StepName stepName, StepWork<T> work) {
        StoryGenerationRun run = startStep(trigger, stepName);
        String step = stepName.format();
        long startTime = System.currentTimeMillis();

        T result;
        try {
            result = work.execute(run);
            runLedgerService.storeStepResult(run.runId(), step, StepResult.completed(result));
        } catch (RuntimeException e) {
            recordFailure(run.runId(), step, e, !run.status().isTerminal());
            throw e;
        }

        log.info("Step {} completed for run {} in {}ms", step, run.runId(), System.currentTimeMillis() - startTime);
        afterStepStored(run);
        progressTracker.refreshQuietly(run.runId());
        return result;
    }

    /**
     * Like {@link #runStep} but a failure leaves the run untouched: the step is recorded as failed
     * and {@code onFailure} supplies the result handed back to the caller.
     */
    protected <T> T runOptionalStep(
            StepTrigger trigger,
            StepName stepName,
            StepWork<T> work,
            Function<RuntimeException, T> onFailure) {
        StoryGenerationRun run = startStep(trigger, stepName);
        String step = stepName.format();

        T result;
        try {
            result = work.execute(run);
            runLedgerService.storeStepResult(run.runId(), step, StepResult.completed(result));
        } catch (RuntimeException e) {
            log.warn("Optional step {} failed for run {}; workflow continues", step, run.runId(), e);
            recordFailure(run.runId(), step, e, false);
            progressTracker.refreshQuietly(run.runId());
            return onFailure.apply(e);
        }

        afterStepStored(run);
        progressTracker.refreshQuietly(run.runId());
        return result;
    }

    /**
     * Hook that runs after the completed step is stored and before progress is refreshed.
     */
    protected void afterStepStored(StoryGenerationRun run) {
    }

    /**
     * The outline recorded for the run.
     *
     * @throws IllegalStateException when the outline step has not completed
     */
    protected BookOutline requireOutline(String runId) {
        StoryGenerationStep step = runLedgerService.findStepResult(runId, StepName.OUTLINE.format())
                .filter(StoryGenerationStep::isCompleted)
                .orElseThrow(() -> new IllegalStateException("No completed outline recorded for run " + runId));
        return outlineParser.fromDetail(step.detail());
    }

    protected Optional<JsonNode> completedDetail(String runId, StepName stepName) {
        return runLedgerService.findStepResult(runId, stepName.format())
                .filter(StoryGenerationStep::isCompleted)
                .map(StoryGenerationStep::detail);
    }

    /**
     * Text of a chapter whose writing step completed, if any.
     */
    protected Optional<String> writtenChapter(String runId, int chapterNumber) {
        return completedDetail(runId, StepName.chapter(chapterNumber))
                .map(detail -> detail.path("content").asText(""))
                .filter(text -> !text.isBlank());
    }

    /**
     * A finished run keeps its status and current step: a replayed step only overwrites its own row.
     */
    private StoryGenerationRun startStep(StepTrigger trigger, StepName stepName) {
        StoryGenerationRun run = runLedgerService.createOrGetRun(
                trigger.storyId(), trigger.workflowId(), trigger.workflowExecution());
        requireNotCancelled(run);
        if (run.status().isTerminal()) {
            log.info("Replaying step {} on {} run {}; run status is kept", stepName, run.status(), run.runId());
            return run;
        }
        log.info("Starting step {} for story {} (run {})", stepName, trigger.storyId(), run.runId());
        return runLedgerService.updateRun(run.runId(), RunUpdate.running(stepName.format()));
    }

    static void requireNotCancelled(StoryGenerationRun run) {
        if (run.status() == RunStatus.CANCELLED) {
            throw new IllegalStateException("Run " + run.runId() + " was cancelled"
                    + (run.errorMessage() != null ? ": " + run.errorMessage() : ""));
        }
    }

    private void recordFailure(String runId, String step, RuntimeException error, boolean failRun) {
        String message = errorMessage(error);
        try {
            runLedgerService.storeStepResult(runId, step, StepResult.failed(message));
            if (failRun) {
                runLedgerService.updateRun(runId, RunUpdate.failed(message));
                log.error("Step {} failed for run {}: {}", step, runId, message, error);
            }
        } catch (RuntimeException ledgerError) {
            error.addSuppressed(ledgerError);
            log.error("Could not record failure of step {} for run {}", step, runId, ledgerError);
        }
    }

    static String errorMessage(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
