package org.example.storybook.service;

/**
 * Base for lookups of runs, steps, contexts and stories that do not exist. Never retried.
 */
public abstract class ResourceNotFoundException extends RuntimeException {

    protected ResourceNotFoundException(String message) {
        super(message);
    }
}
