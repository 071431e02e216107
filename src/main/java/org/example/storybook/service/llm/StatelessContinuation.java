package org.example.storybook.service.llm;

public record StatelessContinuation() implements ProviderContinuation {

    public static final StatelessContinuation INSTANCE = new StatelessContinuation();

    @Override
    public ContinuationKind kind() {
        return ContinuationKind.STATELESS;
    }

    @Override
    public boolean isLive() {
        return false;
    }
}
