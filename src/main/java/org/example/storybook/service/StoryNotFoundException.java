package org.example.storybook.service;

public class StoryNotFoundException extends ResourceNotFoundException {

    public StoryNotFoundException(String storyId) {
        super("Story not found: " + storyId);
    }
}
