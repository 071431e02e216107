package org.example.storybook.model;

import java.util.List;

public record BookOutline(
        String bookTitle,
        String bookCoverPrompt,
        String bookBackCoverPrompt,
        List<Chapter> chapters
) {

    public record Chapter(
            int chapterNumber,
            String chapterTitle,
            String chapterSynopses,
            String chapterPhotoPrompt
    ) {
    }

    public Chapter chapter(int chapterNumber) {
        if (chapters == null) {
            return null;
        }
        return chapters.stream()
                .filter(c -> c.chapterNumber() == chapterNumber)
                .findFirst()
                .orElse(null);
    }
}
