package org.example.storybook.model;

/**
 * Parsed form of a ledger step name such as {@code write_chapter_3} or {@code assemble}.
 * Names that match no known kind keep their raw text and parse to {@link StepKind#UNKNOWN}.
 */
public record StepName(StepKind kind, Integer chapterNumber, String raw) {

    public static final StepName OUTLINE = of(StepKind.GENERATE_OUTLINE);
    public static final StepName FRONT_COVER = of(StepKind.GENERATE_FRONT_COVER);
    public static final StepName BACK_COVER = of(StepKind.GENERATE_BACK_COVER);
    public static final StepName ASSEMBLE = of(StepKind.ASSEMBLE);
    public static final StepName AUDIOBOOK = of(StepKind.GENERATE_AUDIOBOOK);
    public static final StepName DONE = of(StepKind.DONE);

    public static StepName of(StepKind kind) {
        if (kind.isChapterIndexed() || kind == StepKind.UNKNOWN) {
            throw new IllegalArgumentException("Step kind needs a chapter number or raw name: " + kind);
        }
        return new StepName(kind, null, kind.token());
    }

    public static StepName chapter(int chapterNumber) {
        return indexed(StepKind.WRITE_CHAPTER, chapterNumber);
    }

    public static StepName chapterImage(int chapterNumber) {
        return indexed(StepKind.GENERATE_CHAPTER_IMAGE, chapterNumber);
    }

    private static StepName indexed(StepKind kind, int chapterNumber) {
        if (chapterNumber < 1) {
            throw new IllegalArgumentException("Chapter number must be positive: " + chapterNumber);
        }
        return new StepName(kind, chapterNumber, kind.token() + chapterNumber);
    }

    public static StepName parse(String value) {
        if (value == null || value.isBlank()) {
            return new StepName(StepKind.UNKNOWN, null, value);
        }
        String name = value.trim();
        for (StepKind kind : StepKind.values()) {
            if (kind == StepKind.UNKNOWN) {
                continue;
            }
            if (!kind.isChapterIndexed()) {
                if (kind.token().equals(name)) {
                    return new StepName(kind, null, name);
                }
                continue;
            }
            if (name.startsWith(kind.token())) {
                Integer number = parseChapterNumber(name.substring(kind.token().length()));
                if (number != null) {
                    return new StepName(kind, number, name);
                }
            }
        }
        return new StepName(StepKind.UNKNOWN, null, name);
    }

    private static Integer parseChapterNumber(String suffix) {
        if (suffix.isEmpty() || suffix.length() > 6) {
            return null;
        }
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return null;
            }
        }
        int number = Integer.parseInt(suffix);
        return number >= 1 ? number : null;
    }

    public boolean isKnown() {
        return kind != StepKind.UNKNOWN;
    }

    public String format() {
        return raw;
    }

    @Override
    public String toString() {
        return raw;
    }
}
