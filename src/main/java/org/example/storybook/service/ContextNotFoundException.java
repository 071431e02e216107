package org.example.storybook.service;

public class ContextNotFoundException extends ResourceNotFoundException {

    public ContextNotFoundException(String contextId) {
        super("Conversation context not found: " + contextId);
    }
}
