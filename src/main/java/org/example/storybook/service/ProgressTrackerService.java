package org.example.storybook.service;

import org.example.storybook.entity.RunStatus;
import org.example.storybook.entity.StoryStatus;
import org.example.storybook.model.ProgressCalculation;
import org.example.storybook.model.StepName;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.model.StoryGenerationStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns the completed steps of a run into a completion percentage and writes it to the story.
 * <p>
 * Recomputes for the same run never overlap within this process: a call that finds another one
 * in flight returns immediately. Transient persistence failures are retried with a fixed delay.
 */
@Service
public class ProgressTrackerService {

    private static final Logger log = LoggerFactory.getLogger(ProgressTrackerService.class);

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final RunLedgerService runLedgerService;
    private final StoryService storyService;
    private final ChapterCountResolver chapterCountResolver;
    private final StepTimeModel stepTimeModel;
    private final int maxRetries;
    private final long backoffMillis;
    private final Sleeper sleeper;
    private final Set<String> activeUpdates = ConcurrentHashMap.newKeySet();

    @Autowired
    public ProgressTrackerService(
            RunLedgerService runLedgerService,
            StoryService storyService,
            ChapterCountResolver chapterCountResolver,
            StepTimeModel stepTimeModel,
            @Value("${progress.retry.max-retries:3}") int maxRetries,
            @Value("${progress.retry.backoff-ms:1000}") long backoffMillis) {
        this(runLedgerService, storyService, chapterCountResolver, stepTimeModel,
                maxRetries, backoffMillis, Thread::sleep);
    }

    ProgressTrackerService(
            RunLedgerService runLedgerService,
            StoryService storyService,
            ChapterCountResolver chapterCountResolver,
            StepTimeModel stepTimeModel,
            int maxRetries,
            long backoffMillis,
            Sleeper sleeper) {
        this.runLedgerService = runLedgerService;
        this.storyService = storyService;
        this.chapterCountResolver = chapterCountResolver;
        this.stepTimeModel = stepTimeModel;
        this.maxRetries = Math.max(0, maxRetries);
        this.backoffMillis = Math.max(0, backoffMillis);
        this.sleeper = sleeper;
    }

    public ProgressCalculation calculateProgress(String runId) {
        return calculateProgress(runLedgerService.getRun(runId));
    }

    private ProgressCalculation calculateProgress(StoryGenerationRun run) {
        String runId = run.runId();
        int chapterCount = chapterCountResolver.getChapterCount(runId);
        int totalEstimatedTime = stepTimeModel.totalEstimatedTime(chapterCount);

        List<String> completedSteps = runLedgerService.getCompletedSteps(runId).stream()
                .map(StoryGenerationStep::stepName)
                .toList();
        List<StepName> parsed = completedSteps.stream().map(StepName::parse).toList();
        int elapsedTime = stepTimeModel.elapsedTime(parsed, chapterCount);

        int completedPercentage = StepTimeModel.percentage(elapsedTime, totalEstimatedTime);
        int remainingTime = Math.max(totalEstimatedTime - elapsedTime, 0);
        if (isFinished(run)) {
            completedPercentage = 100;
            remainingTime = 0;
        }

        ProgressCalculation progress = new ProgressCalculation(
                completedPercentage,
                totalEstimatedTime,
                elapsedTime,
                remainingTime,
                run.currentStep() != null ? run.currentStep() : "unknown",
                completedSteps,
                stepTimeModel.totalSteps(chapterCount),
                chapterCount
        );
        log.debug("Progress for run {}: {}% ({}s of {}s, {} chapters)",
                runId, completedPercentage, elapsedTime, totalEstimatedTime, chapterCount);
        return progress;
    }

    /**
     * Recomputes the run's progress and stores it on the story. Skips failed runs and calls that
     * overlap an update already running for the same run.
     *
     * @throws ProgressUpdateException when transient failures persist past the retry budget
     */
    public void updateStoryProgress(String runId) {
        if (!activeUpdates.add(runId)) {
            log.debug("Progress update already in progress for run {}, skipping", runId);
            return;
        }
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    applyProgress(runId);
                    return;
                } catch (RuntimeException e) {
                    if (!PersistenceFailures.isTransient(e)) {
                        throw e;
                    }
                    if (attempt > maxRetries) {
                        log.error("Giving up on progress update for run {} after {} attempts", runId, attempt, e);
                        throw new ProgressUpdateException(runId, attempt, e);
                    }
                    log.warn("Transient failure updating progress for run {} (attempt {}/{}): {}",
                            runId, attempt, maxRetries + 1, e.getMessage());
                    pause(runId, attempt, e);
                }
            }
        } finally {
            activeUpdates.remove(runId);
        }
    }

    /**
     * Progress refresh for step handlers: failures are logged, never thrown.
     */
    public void refreshQuietly(String runId) {
        try {
            updateStoryProgress(runId);
        } catch (RuntimeException e) {
            log.warn("Progress update failed for run {}; story completion not advanced", runId, e);
        }
    }

    /**
     * Percentage including partial progress inside a step that is still running.
     *
     * @param stepProgress progress within the step, 0-100
     * @return estimated percentage, or 0 if it cannot be computed
     */
    public int getStepCompletionEstimate(String runId, String stepName, int stepProgress) {
        try {
            ProgressCalculation base = calculateProgress(runId);
            int clampedProgress = Math.max(0, Math.min(100, stepProgress));
            int stepTime = stepTimeModel.stepTime(StepName.parse(stepName), base.chapterCount());
            double elapsed = base.elapsedTime() + stepTime * (clampedProgress / 100.0);
            long rounded = Math.round(100.0 * elapsed / base.totalEstimatedTime());
            return (int) Math.max(base.completedPercentage(), Math.min(rounded, 100));
        } catch (RuntimeException e) {
            log.error("Failed to estimate completion for run {} step {}", runId, stepName, e);
            return 0;
        }
    }

    boolean isUpdateInFlight(String runId) {
        return activeUpdates.contains(runId);
    }

    private void applyProgress(String runId) {
        StoryGenerationRun run = runLedgerService.getRun(runId);
        if (run.status() == RunStatus.FAILED) {
            log.info("Skipping progress update for failed run {}", runId);
            return;
        }

        ProgressCalculation progress = calculateProgress(run);
        storyService.updateStoryCompletionPercentage(run.storyId(), progress.completedPercentage());
        boolean finished = isFinished(run);
        if (finished) {
            storyService.updateStoryStatus(run.storyId(), StoryStatus.PUBLISHED);
        }

        log.info("Updated story {} progress to {}% (run {}, step {}, {}/{} steps{})",
                run.storyId(),
                progress.completedPercentage(),
                runId,
                progress.currentStep(),
                progress.completedSteps().size(),
                progress.totalSteps(),
                finished ? ", published" : "");
    }

    private boolean isFinished(StoryGenerationRun run) {
        return run.status() == RunStatus.COMPLETED && StepName.DONE.format().equals(run.currentStep());
    }

    private void pause(String runId, int attempt, RuntimeException cause) {
        if (backoffMillis == 0) {
            return;
        }
        try {
            sleeper.sleep(backoffMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProgressUpdateException(runId, attempt, cause);
        }
    }
}
