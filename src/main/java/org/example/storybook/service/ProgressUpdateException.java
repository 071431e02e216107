package org.example.storybook.service;

public class ProgressUpdateException extends RuntimeException {

    public ProgressUpdateException(String runId, int attempts, Throwable cause) {
        super("Failed to update progress for run " + runId + " after " + attempts + " attempts", cause);
    }
}
