package org.example.storybook.service.workflow;

import java.util.List;

/**
 * @param missingChapters outline chapters with no completed chapter step, left out of the book
 */
public record AssemblyResult(
        String bookUrl,
        String storageKey,
        String title,
        int chapterCount,
        int imageCount,
        List<Integer> missingChapters
) {
}
