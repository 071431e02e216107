package org.example.storybook.entity;

public enum StoryStatus {
    DRAFT,
    GENERATING,
    PUBLISHED
}
