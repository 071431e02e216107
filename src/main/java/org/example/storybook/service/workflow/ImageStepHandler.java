package org.example.storybook.service.workflow;

import org.example.storybook.model.BookOutline;
import org.example.storybook.model.StepName;
import org.example.storybook.model.StoryContext;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.RunLedgerService;
import org.example.storybook.service.StoryService;
import org.example.storybook.service.media.AssetKeyService;
import org.example.storybook.service.media.AssetStorage;
import org.example.storybook.service.media.ImageOptions;
import org.example.storybook.service.media.ImageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Generates the covers and chapter illustrations and stores them as story assets.
 */
@Service
public class ImageStepHandler extends AbstractStepHandler {

    private static final Logger log = LoggerFactory.getLogger(ImageStepHandler.class);

    private final StoryService storyService;
    private final ImageProvider imageProvider;
    private final AssetStorage assetStorage;
    private final AssetKeyService assetKeyService;
    private final PromptTemplates prompts;

    public ImageStepHandler(
            RunLedgerService runLedgerService,
            ProgressTrackerService progressTracker,
            OutlineParser outlineParser,
            StoryService storyService,
            ImageProvider imageProvider,
            AssetStorage assetStorage,
            AssetKeyService assetKeyService,
            PromptTemplates prompts) {
        super(runLedgerService, progressTracker, outlineParser);
        this.storyService = storyService;
        this.imageProvider = imageProvider;
        this.assetStorage = assetStorage;
        this.assetKeyService = assetKeyService;
        this.prompts = prompts;
    }

    /**
     * @param description explicit picture description; when blank the prompt comes from the outline
     * @param style graphical style overriding the story's own
     */
    public ImageResult generateImage(
            StepTrigger trigger,
            ImageTarget target,
            Integer chapterNumber,
            String description,
            String style) {
        StepName stepName = target.stepName(chapterNumber);
        return runStep(trigger, stepName, run -> generate(run, target, chapterNumber, description, style));
    }

    private ImageResult generate(
            StoryGenerationRun run,
            ImageTarget target,
            Integer chapterNumber,
            String description,
            String style) {
        StoryContext story = storyService.getStoryContext(run.storyId());
        String prompt = buildPrompt(run, story, target, chapterNumber, description, style);

        String prefix = assetKeyService.normalizeSegment(run.storyId());
        ImageOptions options = target == ImageTarget.CHAPTER
                ? ImageOptions.illustration(prefix + "-chapter-" + chapterNumber)
                : ImageOptions.cover(prefix + "-" + target.name().toLowerCase().replace('_', '-'));
        byte[] image = imageProvider.generate(prompt, options);

        String key = switch (target) {
            case FRONT_COVER -> assetKeyService.buildFrontCoverKey(run.storyId());
            case BACK_COVER -> assetKeyService.buildBackCoverKey(run.storyId());
            case CHAPTER -> assetKeyService.buildChapterImageKey(run.storyId(), chapterNumber);
        };
        String storedKey = assetStorage.uploadFile(key, image, "image/png");
        String url = assetStorage.getPublicUrl(storedKey);

        log.info("Generated {} image for run {} with {} ({} bytes)",
                target, run.runId(), imageProvider.getProviderName(), image.length);
        return new ImageResult(
                target.stepName(chapterNumber).format(),
                target == ImageTarget.CHAPTER ? chapterNumber : null,
                url,
                storedKey,
                prompt,
                imageProvider.getProviderName());
    }

    private String buildPrompt(
            StoryGenerationRun run,
            StoryContext story,
            ImageTarget target,
            Integer chapterNumber,
            String description,
            String style) {
        String graphicalStyle = style != null && !style.isBlank() ? style : story.graphicalStyle();
        if (description != null && !description.isBlank()) {
            return prompts.illustration(description, graphicalStyle, "storybook illustration");
        }

        BookOutline outline = requireOutline(run.runId());
        StoryContext styled = withStyle(story, graphicalStyle);
        return switch (target) {
            case FRONT_COVER -> prompts.frontCoverPrompt(styled, outline);
            case BACK_COVER -> prompts.backCoverPrompt(styled, outline);
            case CHAPTER -> {
                BookOutline.Chapter chapter = outline.chapter(chapterNumber);
                if (chapter == null) {
                    throw new IllegalArgumentException("Chapter " + chapterNumber + " is not in the outline");
                }
                yield prompts.chapterImagePrompt(styled, chapter);
            }
        };
    }

    private static StoryContext withStyle(StoryContext story, String graphicalStyle) {
        return new StoryContext(
                story.storyId(),
                story.title(),
                story.plotDescription(),
                story.synopsis(),
                story.place(),
                story.targetAudience(),
                story.novelStyle(),
                graphicalStyle,
                story.storyLanguage(),
                story.chapterCount());
    }
}
