package org.example.storybook.service.llm;

/**
 * Both the stateful turn and the stateless retry came back empty.
 */
public class ProviderContinuityDegenerateException extends LlmProviderException {

    private final String contextId;

    public ProviderContinuityDegenerateException(String providerName, String contextId) {
        super(providerName, "Provider " + providerName + " returned empty output for context "
                + contextId + " after stateless fallback");
        this.contextId = contextId;
    }

    public String getContextId() {
        return contextId;
    }
}
