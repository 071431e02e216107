package org.example.storybook.model;

/**
 * Kinds of workflow steps recorded in the ledger.
 * Chapter-indexed kinds carry a 1-based chapter number in their step name.
 */
public enum StepKind {
    GENERATE_OUTLINE("generate_outline", "generate_outline", false),
    WRITE_CHAPTERS("write_chapters", "write_chapters", false),
    WRITE_CHAPTER("write_chapter_", "write_chapters", true),
    GENERATE_FRONT_COVER("generate_front_cover", "generate_front_cover", false),
    GENERATE_BACK_COVER("generate_back_cover", "generate_back_cover", false),
    GENERATE_IMAGES("generate_images", "generate_images", false),
    GENERATE_CHAPTER_IMAGE("generate_image_chapter_", "generate_images", true),
    ASSEMBLE("assemble", "assemble", false),
    GENERATE_AUDIOBOOK("generate_audiobook", "generate_audiobook", false),
    DONE("done", "done", false),
    UNKNOWN(null, null, false);

    private final String token;
    private final String timeKey;
    private final boolean chapterIndexed;

    StepKind(String token, String timeKey, boolean chapterIndexed) {
        this.token = token;
        this.timeKey = timeKey;
        this.chapterIndexed = chapterIndexed;
    }

    /**
     * Exact step name for fixed kinds, name prefix for chapter-indexed kinds.
     */
    public String token() {
        return token;
    }

    /**
     * Entry of the step time table this kind is estimated against.
     */
    public String timeKey() {
        return timeKey;
    }

    public boolean isChapterIndexed() {
        return chapterIndexed;
    }
}
