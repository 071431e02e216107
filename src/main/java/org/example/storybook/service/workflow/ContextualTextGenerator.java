package org.example.storybook.service.workflow;

import org.example.storybook.model.ConversationContext;
import org.example.storybook.service.ConversationContextManager;
import org.example.storybook.service.llm.ConversationTurn;
import org.example.storybook.service.llm.ConversationalLlmProvider;
import org.example.storybook.service.llm.LlmOptions;
import org.example.storybook.service.llm.ProviderContinuation;
import org.example.storybook.service.llm.ProviderContinuityDegenerateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends one conversational turn through a provider and stores the continuation it returns.
 * <p>
 * An empty stateful reply is retried once as a plain stateless call with the system prompt prepended.
 * If that is empty as well the turn fails with {@link ProviderContinuityDegenerateException}.
 */
@Component
public class ContextualTextGenerator {

    private static final Logger log = LoggerFactory.getLogger(ContextualTextGenerator.class);

    private final ConversationContextManager contextManager;

    public ContextualTextGenerator(ConversationContextManager contextManager) {
        this.contextManager = contextManager;
    }

    public String generate(
            ConversationalLlmProvider provider,
            ConversationContext context,
            String prompt,
            LlmOptions options) {
        String providerKey = provider.getProviderName();
        ProviderContinuation continuation = context.continuation(providerKey);

        ConversationTurn turn = provider.continueConversation(context.systemPrompt(), continuation, prompt, options);
        if (turn != null && !turn.isBlank()) {
            contextManager.updateProviderData(context.contextId(), providerKey, turn.continuation());
            return turn.text().trim();
        }

        log.warn("Provider {} returned empty output for context {}, retrying without continuation",
                providerKey, context.contextId());
        String fallback = provider.generate(statelessPrompt(context.systemPrompt(), prompt), options);
        if (fallback == null || fallback.isBlank()) {
            throw new ProviderContinuityDegenerateException(providerKey, context.contextId());
        }
        return fallback.trim();
    }

    static String statelessPrompt(String systemPrompt, String prompt) {
        if (systemPrompt == null || systemPrompt.isBlank()) {
            return prompt;
        }
        return systemPrompt + "\n\n" + prompt;
    }
}
