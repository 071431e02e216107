package org.example.storybook.service.llm;

public record ResponseIdContinuation(String previousResponseId) implements ProviderContinuation {

    @Override
    public ContinuationKind kind() {
        return ContinuationKind.RESPONSE_ID;
    }

    @Override
    public boolean isLive() {
        return previousResponseId != null && !previousResponseId.isBlank();
    }
}
