package org.example.storybook.controller;

import org.example.storybook.config.WorkflowApiKeyInterceptor;
import org.example.storybook.config.WorkflowApiMvcConfig;
import org.example.storybook.entity.RunStatus;
import org.example.storybook.model.BookOutline;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.service.ContextNotFoundException;
import org.example.storybook.service.ConversationContextManager;
import org.example.storybook.service.RunNotFoundException;
import org.example.storybook.service.workflow.AssemblyStepHandler;
import org.example.storybook.service.workflow.AudiobookStepHandler;
import org.example.storybook.service.workflow.ChapterResult;
import org.example.storybook.service.workflow.ChapterStepHandler;
import org.example.storybook.service.workflow.CompletionResult;
import org.example.storybook.service.workflow.ImageResult;
import org.example.storybook.service.workflow.ImageStepHandler;
import org.example.storybook.service.workflow.ImageTarget;
import org.example.storybook.service.workflow.OutlineStepHandler;
import org.example.storybook.service.workflow.RunCompletionService;
import org.example.storybook.service.workflow.StepTrigger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WorkflowController.class)
@Import({WorkflowApiMvcConfig.class, WorkflowApiKeyInterceptor.class})
class WorkflowControllerTest {

    private static final String API_KEY = "test-workflow-key";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OutlineStepHandler outlineStepHandler;

    @MockitoBean
    private ChapterStepHandler chapterStepHandler;

    @MockitoBean
    private ImageStepHandler imageStepHandler;

    @MockitoBean
    private AssemblyStepHandler assemblyStepHandler;

    @MockitoBean
    private AudiobookStepHandler audiobookStepHandler;

    @MockitoBean
    private RunCompletionService runCompletionService;

    @MockitoBean
    private ConversationContextManager contextManager;

    @Test
    void storyOutline_withoutApiKey_returnsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/workflow/story-outline")
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.error", is("Invalid or missing API key")));

        verifyNoInteractions(outlineStepHandler);
    }

    @Test
    void storyOutline_returnsOutlineMergedIntoEnvelope() throws Exception {
        StepTrigger trigger = new StepTrigger("story-1", "wf-1", "exec-42");
        when(outlineStepHandler.generateOutline(trigger, "Add an owl"))
                .thenReturn(new BookOutline("Pip's Day", "cover", "back", List.of(
                        new BookOutline.Chapter(1, "Morning", "Pip wakes.", "nest"))));

        mockMvc.perform(post("/api/workflow/story-outline")
                        .header("X-API-Key", API_KEY)
                        .header("X-Workflow-Execution", "exec-42")
                        .header("X-Request-Id", "req-7")
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1","prompt":"Add an owl"}
                                """))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-7"))
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.step", is("story-outline")))
                .andExpect(jsonPath("$.storyId", is("story-1")))
                .andExpect(jsonPath("$.workflowId", is("wf-1")))
                .andExpect(jsonPath("$.bookTitle", is("Pip's Day")))
                .andExpect(jsonPath("$.chapters[0].chapterTitle", is("Morning")));
    }

    @Test
    void storyOutline_missingStoryId_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/workflow/story-outline")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"workflowId":"wf-1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.error", is("storyId is required")));
    }

    @Test
    void chapterWriting_zeroBasedIndex_writesNextChapterNumber() throws Exception {
        when(chapterStepHandler.writeChapter(StepTrigger.of("story-1", "wf-1"), 1))
                .thenReturn(new ChapterResult(1, "Morning", "Pip woke up.", 3, "ollama"));

        mockMvc.perform(post("/api/workflow/chapter-writing")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1","chapterIndex":0}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chapterNumber", is(1)))
                .andExpect(jsonPath("$.content", is("Pip woke up.")))
                .andExpect(jsonPath("$.wordCount", is(3)));
    }

    @Test
    void chapterWriting_withoutChapter_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/workflow/chapter-writing")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("chapterNumber must be 1 or greater")));

        verifyNoInteractions(chapterStepHandler);
    }

    @Test
    void chapterWriting_missingContext_returnsNotFound() throws Exception {
        when(chapterStepHandler.writeChapter(any(), anyInt()))
                .thenThrow(new ContextNotFoundException("story-1-wf-1"));

        mockMvc.perform(post("/api/workflow/chapter-writing")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1","chapterNumber":2}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.step", is("chapter-writing")))
                .andExpect(jsonPath("$.error", is("Conversation context not found: story-1-wf-1")));
    }

    @Test
    void chapterWriting_providerFailure_returnsServerError() throws Exception {
        when(chapterStepHandler.writeChapter(any(), anyInt()))
                .thenThrow(new IllegalStateException("No completed outline recorded for run wf-1"));

        mockMvc.perform(post("/api/workflow/chapter-writing")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1","chapterNumber":1}
                                """))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", is("No completed outline recorded for run wf-1")));
    }

    @Test
    void imageGeneration_frontCover_delegatesWithParsedTarget() throws Exception {
        when(imageStepHandler.generateImage(any(), eq(ImageTarget.FRONT_COVER), isNull(), isNull(), eq("crayon")))
                .thenReturn(new ImageResult("generate_front_cover", null, "/assets/front.png",
                        "stories/story-1/images/front-cover.png", "prompt", "comfyui"));

        mockMvc.perform(post("/api/workflow/image-generation")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1","imageType":"front-cover","style":"crayon"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.imageUrl", is("/assets/front.png")))
                .andExpect(jsonPath("$.imageType", is("generate_front_cover")));
    }

    @Test
    void imageGeneration_unknownType_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/workflow/image-generation")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1","imageType":"poster"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Unknown image type: poster")));
    }

    @Test
    void imageGeneration_chapterWithoutNumber_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/workflow/image-generation")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1","imageType":"chapter"}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(imageStepHandler);
    }

    @Test
    void audioRecording_failure_stillReturnsSuccess() throws Exception {
        when(audiobookStepHandler.recordAudiobook(any(), eq("nova")))
                .thenThrow(new RunNotFoundException("wf-1"));

        mockMvc.perform(post("/api/workflow/audio-recording")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1","voice":"nova"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.audioUrl", nullValue()))
                .andExpect(jsonPath("$.error", is("Run not found: wf-1")));
    }

    @Test
    void complete_returnsFinalProgress() throws Exception {
        when(runCompletionService.complete(StepTrigger.of("story-1", "wf-1")))
                .thenReturn(new CompletionResult("wf-1", RunStatus.COMPLETED, "done", 100));

        mockMvc.perform(post("/api/workflow/complete")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("COMPLETED")))
                .andExpect(jsonPath("$.completedPercentage", is(100)));
    }

    @Test
    void fail_marksRunFailed() throws Exception {
        LocalDateTime now = LocalDateTime.now();
        when(runCompletionService.failRun("wf-1", "chapter timeout"))
                .thenReturn(new StoryGenerationRun("wf-1", "story-1", null, RunStatus.FAILED, "write_chapter_2",
                        "chapter timeout", Map.of(), now, now, now, now));

        mockMvc.perform(post("/api/workflow/fail")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1","error":"chapter timeout"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("FAILED")))
                .andExpect(jsonPath("$.errorMessage", is("chapter timeout")));
    }

    @Test
    void fail_unknownRun_returnsNotFound() throws Exception {
        when(runCompletionService.failRun("missing", null)).thenThrow(new RunNotFoundException("missing"));

        mockMvc.perform(post("/api/workflow/fail")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"workflowId":"missing"}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void clearContext_dropsRunConversation() throws Exception {
        mockMvc.perform(post("/api/workflow/context/clear")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","workflowId":"wf-1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contextId", is("story-1-wf-1")));

        verify(contextManager).clearContext("story-1-wf-1");
    }
}
