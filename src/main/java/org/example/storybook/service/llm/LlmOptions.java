package org.example.storybook.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    Double topP,        // nullable
    Integer maxTokens   // nullable
) {

    public static LlmOptions withTemperature(double temp) {
        return new LlmOptions(temp, null, null);
    }

    public static LlmOptions full(double temp, double topP, int maxTokens) {
        return new LlmOptions(temp, topP, maxTokens);
    }

    /**
     * Structured JSON output such as the book outline: low temperature, generous token budget.
     */
    public static LlmOptions structured(int maxTokens) {
        return new LlmOptions(0.4, 0.9, maxTokens);
    }

    /**
     * Narrative prose for chapters.
     */
    public static LlmOptions narrative(int maxTokens) {
        return new LlmOptions(0.8, 0.95, maxTokens);
    }
}
