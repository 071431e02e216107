package org.example.storybook.service.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.entity.RunStatus;
import org.example.storybook.entity.StepStatus;
import org.example.storybook.model.BookOutline;
import org.example.storybook.model.ConversationContext;
import org.example.storybook.model.RunUpdate;
import org.example.storybook.model.StepResult;
import org.example.storybook.model.StoryContext;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.service.ChapterCountResolver;
import org.example.storybook.service.ConversationContextManager;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.RunLedgerService;
import org.example.storybook.service.StoryService;
import org.example.storybook.service.llm.ConversationalLlmProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutlineStepHandlerTest {

    private static final String CONTEXT_ID = "story-1-wf-1";
    private static final String OUTLINE_JSON = """
            Here is your outline:
            {
              "bookTitle": "Pip and the Moon Lantern",
              "bookCoverPrompt": "A small fox holding a glowing lantern",
              "bookBackCoverPrompt": "A quiet forest at night",
              "chapters": [
                {"chapterNumber": 1, "chapterTitle": "The Dark Forest", "chapterSynopses": "Pip gets lost.", "chapterPhotoPrompt": "A fox among tall trees"},
                {"chapterNumber": 2, "chapterTitle": "The Lantern", "chapterSynopses": "Pip finds a lantern.", "chapterPhotoPrompt": "A glowing lantern"}
              ]
            }
            """;

    @Mock
    private RunLedgerService runLedgerService;

    @Mock
    private ProgressTrackerService progressTracker;

    @Mock
    private StoryService storyService;

    @Mock
    private ConversationContextManager contextManager;

    @Mock
    private ContextualTextGenerator textGenerator;

    @Mock
    private ConversationalLlmProvider outlineProvider;

    @Mock
    private ChapterCountResolver chapterCountResolver;

    private final PromptTemplates prompts = new PromptTemplates();
    private OutlineStepHandler handler;

    @BeforeEach
    void setUp() {
        handler = new OutlineStepHandler(
                runLedgerService,
                progressTracker,
                new OutlineParser(new ObjectMapper()),
                storyService,
                contextManager,
                textGenerator,
                outlineProvider,
                prompts,
                chapterCountResolver,
                4000);
    }

    @Test
    void generateOutline_validReply_recordsOutlineAndSeedsChapterContext() {
        stubRun(RunStatus.QUEUED);
        StoryContext story = story();
        when(storyService.getStoryContext("story-1")).thenReturn(story);
        when(contextManager.getContext(CONTEXT_ID)).thenReturn(Optional.of(context()));
        when(textGenerator.generate(eq(outlineProvider), any(), anyString(), any())).thenReturn(OUTLINE_JSON);

        BookOutline outline = handler.generateOutline(StepTrigger.of("story-1", "wf-1"), "Include a friendly owl");

        assertEquals("Pip and the Moon Lantern", outline.bookTitle());
        assertEquals(2, outline.chapters().size());

        verify(contextManager).initializeContext(CONTEXT_ID, "story-1", prompts.storySystemPrompt(story));
        verify(contextManager).initializeContext(CONTEXT_ID, "story-1", prompts.outlineSystemPrompt(story, outline));
        verify(runLedgerService).updateRun("wf-1", RunUpdate.running("generate_outline"));
        verify(runLedgerService).storeStepResult(eq("wf-1"), eq("generate_outline"),
                argThat(result -> result.status() == StepStatus.COMPLETED && result.result() == outline));
        verify(chapterCountResolver).invalidate("wf-1");
        verify(progressTracker).refreshQuietly("wf-1");

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(textGenerator).generate(eq(outlineProvider), any(), prompt.capture(), any());
        assertTrue(prompt.getValue().contains("NUMBER OF CHAPTERS: 3"));
        assertTrue(prompt.getValue().contains("ADDITIONAL DIRECTIONS:\nInclude a friendly owl"));
    }

    @Test
    void generateOutline_firstReplyUnusable_retriesOnce() {
        stubRun(RunStatus.RUNNING);
        when(storyService.getStoryContext("story-1")).thenReturn(story());
        when(contextManager.getContext(CONTEXT_ID)).thenReturn(Optional.of(context()));
        when(textGenerator.generate(eq(outlineProvider), any(), anyString(), any()))
                .thenReturn("Sorry, I cannot help with that.")
                .thenReturn(OUTLINE_JSON);

        BookOutline outline = handler.generateOutline(StepTrigger.of("story-1", "wf-1"), null);

        assertEquals("The Lantern", outline.chapter(2).chapterTitle());
        verify(textGenerator, times(2)).generate(eq(outlineProvider), any(), anyString(), any());
    }

    @Test
    void generateOutline_everyReplyUnusable_failsStepAndRun() {
        stubRun(RunStatus.RUNNING);
        when(storyService.getStoryContext("story-1")).thenReturn(story());
        when(contextManager.getContext(CONTEXT_ID)).thenReturn(Optional.of(context()));
        when(textGenerator.generate(eq(outlineProvider), any(), anyString(), any()))
                .thenReturn("{\"bookTitle\": \"No chapters\"}");

        InvalidOutlineException error = assertThrows(InvalidOutlineException.class,
                () -> handler.generateOutline(StepTrigger.of("story-1", "wf-1"), null));

        assertEquals("Outline has no chapters", error.getMessage());
        verify(runLedgerService).storeStepResult("wf-1", "generate_outline", StepResult.failed("Outline has no chapters"));
        verify(runLedgerService).updateRun("wf-1", RunUpdate.failed("Outline has no chapters"));
        verify(chapterCountResolver, never()).invalidate(anyString());
        verify(progressTracker, never()).refreshQuietly(anyString());
    }

    @Test
    void generateOutline_completedRunReplayFails_recordsStepButKeepsRunCompleted() {
        when(runLedgerService.createOrGetRun("story-1", "wf-1", null)).thenReturn(run(RunStatus.COMPLETED));
        when(storyService.getStoryContext("story-1")).thenReturn(story());
        when(contextManager.getContext(CONTEXT_ID)).thenReturn(Optional.of(context()));
        when(textGenerator.generate(eq(outlineProvider), any(), anyString(), any()))
                .thenReturn("{\"bookTitle\": \"No chapters\"}");

        assertThrows(InvalidOutlineException.class,
                () -> handler.generateOutline(StepTrigger.of("story-1", "wf-1"), null));

        verify(runLedgerService).storeStepResult("wf-1", "generate_outline", StepResult.failed("Outline has no chapters"));
        verify(runLedgerService, never()).updateRun(anyString(), any());
    }

    @Test
    void generateOutline_completedRunReplay_overwritesStepWithoutReopeningRun() {
        when(runLedgerService.createOrGetRun("story-1", "wf-1", null)).thenReturn(run(RunStatus.COMPLETED));
        when(storyService.getStoryContext("story-1")).thenReturn(story());
        when(contextManager.getContext(CONTEXT_ID)).thenReturn(Optional.of(context()));
        when(textGenerator.generate(eq(outlineProvider), any(), anyString(), any())).thenReturn(OUTLINE_JSON);

        handler.generateOutline(StepTrigger.of("story-1", "wf-1"), null);

        verify(runLedgerService, never()).updateRun(anyString(), any());
        verify(runLedgerService).storeStepResult(eq("wf-1"), eq("generate_outline"),
                argThat(result -> result.status() == StepStatus.COMPLETED));
        verify(progressTracker).refreshQuietly("wf-1");
    }

    @Test
    void generateOutline_cancelledRun_isRefused() {
        when(runLedgerService.createOrGetRun("story-1", "wf-1", null)).thenReturn(run(RunStatus.CANCELLED));

        assertThrows(IllegalStateException.class,
                () -> handler.generateOutline(StepTrigger.of("story-1", "wf-1"), null));

        verifyNoInteractions(textGenerator, contextManager, storyService);
    }

    private void stubRun(RunStatus initialStatus) {
        when(runLedgerService.createOrGetRun("story-1", "wf-1", null)).thenReturn(run(initialStatus));
        when(runLedgerService.updateRun(eq("wf-1"), any())).thenReturn(run(RunStatus.RUNNING));
    }

    private static StoryGenerationRun run(RunStatus status) {
        LocalDateTime now = LocalDateTime.now();
        return new StoryGenerationRun("wf-1", "story-1", null, status, "generate_outline",
                status == RunStatus.CANCELLED ? "Superseded by run wf-2" : null,
                Map.of(), now, null, now, now);
    }

    private static StoryContext story() {
        return new StoryContext("story-1", "Pip's Night", "A fox cub looks for the moon", null,
                "Whispering Woods", "6-8", "adventure", "watercolor", "en", 3);
    }

    private static ConversationContext context() {
        LocalDateTime now = LocalDateTime.now();
        return new ConversationContext(CONTEXT_ID, "story-1", "system", Map.of(), now, now);
    }
}
