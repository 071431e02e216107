package org.example.storybook.entity;

import java.io.Serializable;
import java.util.Objects;

public class StoryGenerationStepId implements Serializable {

    private String runId;
    private String stepName;

    public StoryGenerationStepId() {
    }

    public StoryGenerationStepId(String runId, String stepName) {
        this.runId = runId;
        this.stepName = stepName;
    }

    public String getRunId() {
        return runId;
    }

    public String getStepName() {
        return stepName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoryGenerationStepId that)) {
            return false;
        }
        return Objects.equals(runId, that.runId) && Objects.equals(stepName, that.stepName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, stepName);
    }
}
