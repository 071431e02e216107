package org.example.storybook.service.workflow;

import org.example.storybook.model.BookOutline;
import org.example.storybook.model.ConversationContext;
import org.example.storybook.model.StepName;
import org.example.storybook.model.StoryContext;
import org.example.storybook.model.StoryGenerationRun;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes one chapter as the next turn of the run's conversation.
 */
@Service
public class ChapterStepHandler extends AbstractStepHandler {

    private static final Logger log = LoggerFactory.getLogger(ChapterStepHandler.class);
    private static final int FULL_TEXT_CHAPTERS = 2;

    private final StoryService storyService;
    private final ConversationContextManager contextManager;
    private final ContextualTextGenerator textGenerator;
    private final ConversationalLlmProvider chapterProvider;
    private final PromptTemplates prompts;
    private final int maxTokens;
    private final int memoryMaxChars;

    public ChapterStepHandler(
            RunLedgerService runLedgerService,
            ProgressTrackerService progressTracker,
            OutlineParser outlineParser,
            StoryService storyService,
            ConversationContextManager contextManager,
            ContextualTextGenerator textGenerator,
            @Qualifier("chapterLlmProvider") ConversationalLlmProvider chapterProvider,
            PromptTemplates prompts,
            @Value("${workflow.chapter.max-tokens:2500}") int maxTokens,
            @Value("${workflow.chapter.memory-max-chars:12000}") int memoryMaxChars) {
        super(runLedgerService, progressTracker, outlineParser);
        this.storyService = storyService;
        this.contextManager = contextManager;
        this.textGenerator = textGenerator;
        this.chapterProvider = chapterProvider;
        this.prompts = prompts;
        this.maxTokens = maxTokens;
        this.memoryMaxChars = memoryMaxChars;
    }

    public ChapterResult writeChapter(StepTrigger trigger, int chapterNumber) {
        return runStep(trigger, StepName.chapter(chapterNumber), run -> write(run, chapterNumber));
    }

    private ChapterResult write(StoryGenerationRun run, int chapterNumber) {
        BookOutline outline = requireOutline(run.runId());
        BookOutline.Chapter chapter = outline.chapter(chapterNumber);
        if (chapter == null) {
            throw new IllegalArgumentException("Chapter " + chapterNumber + " is not in the outline ("
                    + outline.chapters().size() + " chapters)");
        }

        ConversationContext context = resolveContext(run, outline);
        String memory = buildMemory(run.runId(), outline, chapterNumber);
        String prompt = prompts.chapterPrompt(chapter, outline.chapters().size(), memory);

        String content = textGenerator.generate(chapterProvider, context, prompt, LlmOptions.narrative(maxTokens));
        int wordCount = countWords(content);
        log.info("Wrote chapter {}/{} for run {} ({} words)",
                chapterNumber, outline.chapters().size(), run.runId(), wordCount);
        return new ChapterResult(chapterNumber, chapter.chapterTitle(), content, wordCount,
                chapterProvider.getProviderName());
    }

    /**
     * Reuses the run's context when the outline step left one, otherwise creates it from the outline.
     */
    private ConversationContext resolveContext(StoryGenerationRun run, BookOutline outline) {
        String contextId = ConversationContext.contextIdFor(run.storyId(), run.runId());
        Optional<ConversationContext> existing = contextManager.getContext(contextId);
        if (existing.isPresent()) {
            log.debug("Reusing conversation context {}", contextId);
            return existing.get();
        }

        StoryContext story = storyService.getStoryContext(run.storyId());
        contextManager.initializeContext(contextId, run.storyId(), prompts.outlineSystemPrompt(story, outline));
        log.info("Created conversation context {} for chapter writing", contextId);
        return contextManager.getContext(contextId)
                .orElseThrow(() -> new ContextNotFoundException(contextId));
    }

    /**
     * Earlier chapters for the prompt: synopses for older ones, the last two in full when recorded.
     * Oldest synopses are dropped first when the block exceeds the configured size.
     */
    String buildMemory(String runId, BookOutline outline, int chapterNumber) {
        List<String> summaries = new ArrayList<>();
        List<String> fullTexts = new ArrayList<>();
        for (int previous = 1; previous < chapterNumber; previous++) {
            BookOutline.Chapter planned = outline.chapter(previous);
            String title = planned != null ? planned.chapterTitle() : "Chapter " + previous;
            Optional<String> written = previous >= chapterNumber - FULL_TEXT_CHAPTERS
                    ? writtenChapter(runId, previous)
                    : Optional.empty();
            if (written.isPresent()) {
                fullTexts.add("Chapter " + previous + " - " + title + " (full text):\n" + written.get());
            } else {
                String synopsis = planned != null && planned.chapterSynopses() != null
                        ? planned.chapterSynopses()
                        : "(no synopsis)";
                summaries.add("Chapter " + previous + " - " + title + ": " + synopsis);
            }
        }

        while (!summaries.isEmpty() && joinedLength(summaries, fullTexts) > memoryMaxChars) {
            summaries.remove(0);
        }
        List<String> sections = new ArrayList<>(summaries);
        sections.addAll(fullTexts);
        String memory = String.join("\n\n", sections);
        if (memory.length() > memoryMaxChars) {
            memory = "..." + memory.substring(memory.length() - Math.max(memoryMaxChars - 3, 0));
        }
        return memory;
    }

    private static int joinedLength(List<String> summaries, List<String> fullTexts) {
        int length = 0;
        for (String section : summaries) {
            length += section.length() + 2;
        }
        for (String section : fullTexts) {
            length += section.length() + 2;
        }
        return length;
    }

    static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
