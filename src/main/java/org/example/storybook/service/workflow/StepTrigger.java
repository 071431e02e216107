package org.example.storybook.service.workflow;

/**
 * Identifies the run a workflow step belongs to.
 *
 * @param storyId story being generated
 * @param workflowId run id assigned by the external workflow; null lets the ledger pick or create one
 * @param workflowExecution external execution handle, recorded on newly created runs
 */
public record StepTrigger(String storyId, String workflowId, String workflowExecution) {

    public StepTrigger {
        if (storyId == null || storyId.isBlank()) {
            throw new IllegalArgumentException("storyId is required");
        }
    }

    public static StepTrigger of(String storyId, String workflowId) {
        return new StepTrigger(storyId, workflowId, null);
    }
}
