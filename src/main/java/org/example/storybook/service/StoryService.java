package org.example.storybook.service;

import org.example.storybook.entity.StoryEntity;
import org.example.storybook.entity.StoryStatus;
import org.example.storybook.model.StoryContext;
import org.example.storybook.repository.StoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Read access to story records plus the two fields the generation pipeline writes back.
 */
@Service
public class StoryService {

    private static final Logger log = LoggerFactory.getLogger(StoryService.class);

    private final StoryRepository storyRepository;

    public StoryService(StoryRepository storyRepository) {
        this.storyRepository = storyRepository;
    }

    public StoryEntity getStory(String storyId) {
        return storyRepository.findById(storyId)
                .orElseThrow(() -> new StoryNotFoundException(storyId));
    }

    public Optional<StoryEntity> findStory(String storyId) {
        if (storyId == null || storyId.isBlank()) {
            return Optional.empty();
        }
        return storyRepository.findById(storyId);
    }

    public StoryContext getStoryContext(String storyId) {
        StoryEntity story = getStory(storyId);
        return new StoryContext(
                story.getId(),
                story.getTitle(),
                story.getPlotDescription(),
                story.getSynopsis(),
                story.getPlace(),
                story.getTargetAudience(),
                story.getNovelStyle(),
                story.getGraphicalStyle(),
                story.getStoryLanguage() != null ? story.getStoryLanguage() : "en",
                story.getChapterCount()
        );
    }

    public void updateStoryCompletionPercentage(String storyId, int percentage) {
        int clamped = Math.max(0, Math.min(100, percentage));
        int updated = storyRepository.updateCompletionPercentage(storyId, clamped, LocalDateTime.now());
        if (updated == 0) {
            throw new StoryNotFoundException(storyId);
        }
        log.debug("Story {} completion set to {}%", storyId, clamped);
    }

    public void updateStoryStatus(String storyId, StoryStatus status) {
        int updated = storyRepository.updateStatus(storyId, status, LocalDateTime.now());
        if (updated == 0) {
            throw new StoryNotFoundException(storyId);
        }
        log.info("Story {} status set to {}", storyId, status);
    }
}
