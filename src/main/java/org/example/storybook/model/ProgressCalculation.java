package org.example.storybook.model;

import java.util.List;

/**
 * Progress snapshot for a run. Times are in estimated seconds.
 */
public record ProgressCalculation(
        int completedPercentage,
        int totalEstimatedTime,
        int elapsedTime,
        int remainingTime,
        String currentStep,
        List<String> completedSteps,
        int totalSteps,
        int chapterCount
) {
}
