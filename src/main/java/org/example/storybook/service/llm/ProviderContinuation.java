package org.example.storybook.service.llm;

/**
 * Per-provider conversation continuation stored in a conversation context slot.
 */
public interface ProviderContinuation {

    ContinuationKind kind();

    /**
     * Whether a provider can resume from this continuation in the current process.
     */
    boolean isLive();
}
