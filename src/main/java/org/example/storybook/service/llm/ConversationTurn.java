package org.example.storybook.service.llm;

public record ConversationTurn(String text, ProviderContinuation continuation) {

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
