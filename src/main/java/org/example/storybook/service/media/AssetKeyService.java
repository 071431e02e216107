package org.example.storybook.service.media;

import org.springframework.stereotype.Service;

/**
 * Storage key layout for a story's generated assets.
 */
@Service
public class AssetKeyService {

    private static final int MAX_SEGMENT_LENGTH = 64;

    public String buildStoryKey(String storyId) {
        String segment = normalizeSegment(storyId);
        if (segment.isBlank()) {
            throw new IllegalArgumentException("storyId is required for asset keys");
        }
        return "stories/" + segment;
    }

    public String buildFrontCoverKey(String storyId) {
        return buildStoryKey(storyId) + "/images/front-cover.png";
    }

    public String buildBackCoverKey(String storyId) {
        return buildStoryKey(storyId) + "/images/back-cover.png";
    }

    public String buildChapterImageKey(String storyId, int chapterNumber) {
        return buildStoryKey(storyId) + "/images/chapters/" + chapterNumber + ".png";
    }

    public String buildBookKey(String storyId) {
        return buildStoryKey(storyId) + "/book/index.html";
    }

    public String buildAudioPrefix(String storyId) {
        return buildStoryKey(storyId) + "/audio/";
    }

    public String buildChapterAudioKey(String storyId, String voice, int chapterNumber) {
        String voiceSegment = normalizeSegment(voice);
        if (voiceSegment.isBlank()) {
            voiceSegment = "default";
        }
        return buildAudioPrefix(storyId) + voiceSegment + "/chapter-" + chapterNumber + ".mp3";
    }

    public String normalizeSegment(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.trim().toLowerCase();
        normalized = normalized.replaceAll("[^a-z0-9]+", "-");
        normalized = normalized.replaceAll("^-+", "").replaceAll("-+$", "");
        if (normalized.length() > MAX_SEGMENT_LENGTH) {
            normalized = normalized.substring(0, MAX_SEGMENT_LENGTH);
            normalized = normalized.replaceAll("-+$", "");
        }
        return normalized;
    }
}
