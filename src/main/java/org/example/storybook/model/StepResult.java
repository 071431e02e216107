package org.example.storybook.model;

import org.example.storybook.entity.StepStatus;

public record StepResult(StepStatus status, Object result, String error) {

    public static StepResult running() {
        return new StepResult(StepStatus.RUNNING, null, null);
    }

    public static StepResult completed(Object result) {
        return new StepResult(StepStatus.COMPLETED, result, null);
    }

    public static StepResult failed(String error) {
        return new StepResult(StepStatus.FAILED, null, error);
    }
}
