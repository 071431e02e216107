package org.example.storybook.service.llm;

/**
 * Slot holding an in-process chat session. A null session means the handle did not survive
 * a restart; providers start a new session seeded with the system prompt.
 */
public record ChatSessionContinuation(ChatSession session) implements ProviderContinuation {

    public static ChatSessionContinuation lost() {
        return new ChatSessionContinuation(null);
    }

    @Override
    public ContinuationKind kind() {
        return ContinuationKind.CHAT_SESSION;
    }

    @Override
    public boolean isLive() {
        return session != null;
    }
}
