package org.example.storybook.model;

/**
 * Story fields used to fill prompt templates.
 */
public record StoryContext(
        String storyId,
        String title,
        String plotDescription,
        String synopsis,
        String place,
        String targetAudience,
        String novelStyle,
        String graphicalStyle,
        String storyLanguage,
        Integer chapterCount
) {
}
