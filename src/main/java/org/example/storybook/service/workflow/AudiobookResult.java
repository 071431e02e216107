package org.example.storybook.service.workflow;

import java.util.Map;

/**
 * Narration produced for a run. On failure the URLs are empty and {@code error} says why.
 *
 * @param audioUrl URL of the first narrated chapter
 * @param audioUrls chapter number to audio URL
 */
public record AudiobookResult(
        String audioUrl,
        Map<Integer, String> audioUrls,
        String voice,
        int chaptersProcessed,
        String provider,
        String error
) {

    public static AudiobookResult failed(String error) {
        return new AudiobookResult(null, Map.of(), null, 0, null, error);
    }
}
