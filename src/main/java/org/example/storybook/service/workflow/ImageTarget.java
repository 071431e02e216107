package org.example.storybook.service.workflow;

import org.example.storybook.model.StepName;

import java.util.Locale;

/**
 * Which illustration of the book an image step produces.
 */
public enum ImageTarget {
    FRONT_COVER,
    BACK_COVER,
    CHAPTER;

    public StepName stepName(Integer chapterNumber) {
        return switch (this) {
            case FRONT_COVER -> StepName.FRONT_COVER;
            case BACK_COVER -> StepName.BACK_COVER;
            case CHAPTER -> {
                if (chapterNumber == null) {
                    throw new IllegalArgumentException("chapterNumber is required for chapter images");
                }
                yield StepName.chapterImage(chapterNumber);
            }
        };
    }

    /**
     * Accepts {@code front_cover}, {@code front-cover}, {@code FRONT_COVER} and so on; null means chapter.
     */
    public static ImageTarget fromValue(String value) {
        if (value == null || value.isBlank()) {
            return CHAPTER;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown image type: " + value, e);
        }
    }
}
