package org.example.storybook.service;

public class RunNotFoundException extends ResourceNotFoundException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
