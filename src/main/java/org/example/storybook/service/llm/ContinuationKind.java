package org.example.storybook.service.llm;

public enum ContinuationKind {
    /** In-process chat session handle; lost on restart. */
    CHAT_SESSION,
    /** Previous-response token held by the provider; durable. */
    RESPONSE_ID,
    STATELESS
}
