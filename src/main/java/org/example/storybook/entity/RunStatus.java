package org.example.storybook.entity;

public enum RunStatus {
    QUEUED,
    RUNNING,
    FAILED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FAILED || this == COMPLETED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }
}
