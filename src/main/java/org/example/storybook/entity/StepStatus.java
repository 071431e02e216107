package org.example.storybook.entity;

public enum StepStatus {
    PENDING,
    RUNNING,
    FAILED,
    COMPLETED
}
