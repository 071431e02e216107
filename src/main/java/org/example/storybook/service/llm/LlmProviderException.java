package org.example.storybook.service.llm;

/**
 * A provider call failed or returned output the caller cannot use.
 */
public class LlmProviderException extends RuntimeException {

    private final String providerName;

    public LlmProviderException(String providerName, String message) {
        super(message);
        this.providerName = providerName;
    }

    public LlmProviderException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
