package org.example.storybook.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import org.example.storybook.model.StepName;
import org.example.storybook.model.StoryGenerationStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Discovers how many chapters a run will produce.
 * <p>
 * Lookup order: the completed outline's {@code chapters} array, "Chapter N" mentions in a plain-text
 * outline, the story's own chapter count, then {@link #DEFAULT_CHAPTER_COUNT}. Results are cached per
 * run for the lifetime of the injected cache.
 */
@Component
public class ChapterCountResolver {

    /**
     * Used when neither the outline nor the story says how many chapters there are.
     * Kept as the historical business default; it has no stronger justification.
     */
    public static final int DEFAULT_CHAPTER_COUNT = 4;

    private static final Logger log = LoggerFactory.getLogger(ChapterCountResolver.class);
    private static final Pattern CHAPTER_MENTION = Pattern.compile("Chapter\\s+\\d+", Pattern.CASE_INSENSITIVE);

    private final RunLedgerService runLedgerService;
    private final StoryService storyService;
    private final Cache<String, Integer> chapterCountCache;

    public ChapterCountResolver(
            RunLedgerService runLedgerService,
            StoryService storyService,
            @Qualifier("chapterCountCache") Cache<String, Integer> chapterCountCache) {
        this.runLedgerService = runLedgerService;
        this.storyService = storyService;
        this.chapterCountCache = chapterCountCache;
    }

    public int getChapterCount(String runId) {
        return chapterCountCache.get(runId, this::resolve);
    }

    /**
     * Drops the cached count, e.g. after a new outline was recorded for the run.
     */
    public void invalidate(String runId) {
        chapterCountCache.invalidate(runId);
    }

    private int resolve(String runId) {
        try {
            Optional<StoryGenerationStep> outline = runLedgerService.findStepResult(runId, StepName.OUTLINE.format())
                    .filter(StoryGenerationStep::isCompleted);
            if (outline.isPresent()) {
                int fromOutline = countFromOutline(outline.get().detail());
                if (fromOutline > 0) {
                    log.debug("Chapter count {} for run {} taken from outline", fromOutline, runId);
                    return fromOutline;
                }
            }

            String storyId = runLedgerService.getRun(runId).storyId();
            Integer fromStory = storyService.findStory(storyId)
                    .map(story -> story.getChapterCount())
                    .orElse(null);
            if (fromStory != null && fromStory > 0) {
                log.debug("Chapter count {} for run {} taken from story {}", fromStory, runId, storyId);
                return fromStory;
            }

            log.warn("No chapter count found for run {}, using default of {}", runId, DEFAULT_CHAPTER_COUNT);
            return DEFAULT_CHAPTER_COUNT;
        } catch (RuntimeException e) {
            log.error("Failed to resolve chapter count for run {}, using default of {}",
                    runId, DEFAULT_CHAPTER_COUNT, e);
            return DEFAULT_CHAPTER_COUNT;
        }
    }

    private int countFromOutline(JsonNode detail) {
        if (detail == null || detail.isNull()) {
            return 0;
        }
        JsonNode chapters = detail.get("chapters");
        if (chapters != null && chapters.isArray() && chapters.size() > 0) {
            return chapters.size();
        }
        JsonNode content = detail.get("content");
        if (content != null && content.isTextual()) {
            Matcher matcher = CHAPTER_MENTION.matcher(content.asText());
            int mentions = 0;
            while (matcher.find()) {
                mentions++;
            }
            return mentions;
        }
        return 0;
    }
}
