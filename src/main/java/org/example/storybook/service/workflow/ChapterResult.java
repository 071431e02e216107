package org.example.storybook.service.workflow;

public record ChapterResult(
        int chapterNumber,
        String chapterTitle,
        String content,
        int wordCount,
        String provider
) {
}
