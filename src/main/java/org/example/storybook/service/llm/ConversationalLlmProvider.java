package org.example.storybook.service.llm;

/**
 * Provider that can carry conversation state between calls.
 * Each provider produces exactly one kind of continuation.
 */
public interface ConversationalLlmProvider extends LlmProvider {

    /**
     * Sends the next user turn of a conversation.
     *
     * @param systemPrompt instructions for the whole conversation
     * @param continuation the slot previously returned by this provider, or null to start fresh
     * @param prompt the user turn
     * @param options generation options
     * @return generated text plus the continuation to store for the next turn
     */
    ConversationTurn continueConversation(
            String systemPrompt,
            ProviderContinuation continuation,
            String prompt,
            LlmOptions options);

    ContinuationKind continuationKind();
}
