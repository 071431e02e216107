package org.example.storybook.service.llm;

/**
 * Text generation backend (Ollama, xAI).
 */
public interface LlmProvider {

    /**
     * Single-shot generation with no conversation state.
     *
     * @param prompt the full prompt, system instructions included
     * @param options generation options
     * @return the generated text, possibly blank
     */
    String generate(String prompt, LlmOptions options);

    boolean isAvailable();

    /**
     * Provider name, also used as the key of this provider's slot in a conversation context.
     */
    String getProviderName();
}
