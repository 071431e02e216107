package org.example.storybook.model;

import org.example.storybook.service.llm.ProviderContinuation;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Conversation continuity for one run: the system prompt plus one continuation slot per provider.
 */
public record ConversationContext(
        String contextId,
        String storyId,
        String systemPrompt,
        Map<String, ProviderContinuation> providerData,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static String contextIdFor(String storyId, String runId) {
        return storyId + "-" + runId;
    }

    public ProviderContinuation continuation(String providerKey) {
        return providerData != null ? providerData.get(providerKey) : null;
    }
}
