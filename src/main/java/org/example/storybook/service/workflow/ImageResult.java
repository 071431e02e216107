package org.example.storybook.service.workflow;

public record ImageResult(
        String imageType,
        Integer chapterNumber,
        String imageUrl,
        String storageKey,
        String prompt,
        String provider
) {
}
