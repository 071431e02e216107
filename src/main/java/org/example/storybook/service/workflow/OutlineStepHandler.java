package org.example.storybook.service.workflow;

import org.example.storybook.model.BookOutline;
import org.example.storybook.model.ConversationContext;
import org.example.storybook.model.StepName;
import org.example.storybook.model.StoryContext;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.service.ChapterCountResolver;
import org.example.storybook.service.ContextNotFoundException;
import org.example.storybook.service.ConversationContextManager;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.RunLedgerService;
import org.example.storybook.service.StoryService;
import org.example.storybook.service.llm.ConversationalLlmProvider;
import org.example.storybook.service.llm.LlmOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Generates the book outline that opens a run's conversation.
 * <p>
 * The context is seeded with the story system prompt, the outline is requested as JSON (one retry
 * on an unusable reply), and the system prompt is then replaced by one carrying the condensed
 * outline so chapter turns see it.
 */
@Service
public class OutlineStepHandler extends AbstractStepHandler {

    private static final Logger log = LoggerFactory.getLogger(OutlineStepHandler.class);
    static final int MAX_ATTEMPTS = 2;

    private final StoryService storyService;
    private final ConversationContextManager contextManager;
    private final ContextualTextGenerator textGenerator;
    private final ConversationalLlmProvider outlineProvider;
    private final PromptTemplates prompts;
    private final ChapterCountResolver chapterCountResolver;
    private final int maxTokens;

    public OutlineStepHandler(
            RunLedgerService runLedgerService,
            ProgressTrackerService progressTracker,
            OutlineParser outlineParser,
            StoryService storyService,
            ConversationContextManager contextManager,
            ContextualTextGenerator textGenerator,
            @Qualifier("outlineLlmProvider") ConversationalLlmProvider outlineProvider,
            PromptTemplates prompts,
            ChapterCountResolver chapterCountResolver,
            @Value("${workflow.outline.max-tokens:4000}") int maxTokens) {
        super(runLedgerService, progressTracker, outlineParser);
        this.storyService = storyService;
        this.contextManager = contextManager;
        this.textGenerator = textGenerator;
        this.outlineProvider = outlineProvider;
        this.prompts = prompts;
        this.chapterCountResolver = chapterCountResolver;
        this.maxTokens = maxTokens;
    }

    /**
     * @param directions optional extra guidance from the trigger, appended to the outline prompt
     */
    public BookOutline generateOutline(StepTrigger trigger, String directions) {
        return runStep(trigger, StepName.OUTLINE, run -> buildOutline(run, directions));
    }

    @Override
    protected void afterStepStored(StoryGenerationRun run) {
        chapterCountResolver.invalidate(run.runId());
    }

    private BookOutline buildOutline(StoryGenerationRun run, String directions) {
        StoryContext story = storyService.getStoryContext(run.storyId());
        String contextId = ConversationContext.contextIdFor(run.storyId(), run.runId());
        contextManager.initializeContext(contextId, run.storyId(), prompts.storySystemPrompt(story));

        int chapterCount = story.chapterCount() != null && story.chapterCount() > 0
                ? story.chapterCount()
                : ChapterCountResolver.DEFAULT_CHAPTER_COUNT;
        String prompt = prompts.outlinePrompt(story, chapterCount);
        if (directions != null && !directions.isBlank()) {
            prompt = prompt + "\nADDITIONAL DIRECTIONS:\n" + directions.trim() + "\n";
        }

        BookOutline outline = null;
        InvalidOutlineException lastError = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS && outline == null; attempt++) {
            ConversationContext context = contextManager.getContext(contextId)
                    .orElseThrow(() -> new ContextNotFoundException(contextId));
            String generated = textGenerator.generate(outlineProvider, context, prompt, LlmOptions.structured(maxTokens));
            try {
                outline = outlineParser.parse(generated);
            } catch (InvalidOutlineException e) {
                lastError = e;
                log.warn("Outline attempt {}/{} for run {} was unusable: {}",
                        attempt, MAX_ATTEMPTS, run.runId(), e.getMessage());
            }
        }
        if (outline == null) {
            throw lastError;
        }

        contextManager.initializeContext(contextId, run.storyId(), prompts.outlineSystemPrompt(story, outline));
        log.info("Outline for story {} has {} chapters: \"{}\"",
                run.storyId(), outline.chapters().size(), outline.bookTitle());
        return outline;
    }
}
