package org.example.storybook.service.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Message history of a chat-style conversation kept in memory.
 */
public class ChatSession {

    private final String sessionId;
    private final List<ChatMessage> messages = new ArrayList<>();

    public ChatSession(String systemPrompt) {
        this.sessionId = UUID.randomUUID().toString();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(ChatMessage.system(systemPrompt));
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Replaces the leading system message, or inserts one, keeping the rest of the history.
     */
    public synchronized void updateSystemPrompt(String systemPrompt) {
        boolean hasSystem = !messages.isEmpty() && "system".equals(messages.get(0).role());
        if (systemPrompt == null || systemPrompt.isBlank()) {
            if (hasSystem) {
                messages.remove(0);
            }
            return;
        }
        if (hasSystem) {
            messages.set(0, ChatMessage.system(systemPrompt));
        } else {
            messages.add(0, ChatMessage.system(systemPrompt));
        }
    }

    public synchronized void append(ChatMessage message) {
        messages.add(message);
    }

    /**
     * Drops the trailing user turn after a call that produced no reply.
     */
    public synchronized void discardLastUserTurn() {
        int last = messages.size() - 1;
        if (last >= 0 && "user".equals(messages.get(last).role())) {
            messages.remove(last);
        }
    }

    public synchronized List<ChatMessage> snapshot() {
        return List.copyOf(messages);
    }

    public synchronized int size() {
        return messages.size();
    }
}
