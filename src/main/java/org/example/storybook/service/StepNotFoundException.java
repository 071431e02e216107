package org.example.storybook.service;

public class StepNotFoundException extends ResourceNotFoundException {

    public StepNotFoundException(String runId, String stepName) {
        super("Step not found: " + runId + "/" + stepName);
    }
}
