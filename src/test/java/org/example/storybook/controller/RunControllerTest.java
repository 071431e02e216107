package org.example.storybook.controller;

import org.example.storybook.config.WorkflowApiKeyInterceptor;
import org.example.storybook.config.WorkflowApiMvcConfig;
import org.example.storybook.entity.RunStatus;
import org.example.storybook.entity.StepStatus;
import org.example.storybook.model.ProgressCalculation;
import org.example.storybook.model.RunUpdate;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.model.StoryGenerationStep;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.ProgressUpdateException;
import org.example.storybook.service.RunLedgerService;
import org.example.storybook.service.RunNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RunController.class)
@Import({WorkflowApiMvcConfig.class, WorkflowApiKeyInterceptor.class})
class RunControllerTest {

    private static final String API_KEY = "test-workflow-key";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RunLedgerService runLedgerService;

    @MockitoBean
    private ProgressTrackerService progressTrackerService;

    @Test
    void createRun_usesExecutionHeaderWhenBodyHasNone() throws Exception {
        when(runLedgerService.createOrGetRun("story-1", "wf-1", "exec-3")).thenReturn(run(RunStatus.QUEUED));

        mockMvc.perform(post("/api/runs")
                        .header("X-API-Key", API_KEY)
                        .header("X-Workflow-Execution", "exec-3")
                        .contentType("application/json")
                        .content("""
                                {"storyId":"story-1","runId":"wf-1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId", is("wf-1")))
                .andExpect(jsonPath("$.status", is("QUEUED")));
    }

    @Test
    void createRun_missingStory_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/runs")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("storyId is required")));

        verifyNoInteractions(runLedgerService);
    }

    @Test
    void getRun_unknown_returnsNotFound() throws Exception {
        when(runLedgerService.findRun("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/runs/missing").header("X-API-Key", API_KEY))
                .andExpect(status().isNotFound());
    }

    @Test
    void updateRun_parsesStatusCaseInsensitively() throws Exception {
        when(runLedgerService.updateRun(eq("wf-1"), any())).thenReturn(run(RunStatus.RUNNING));

        mockMvc.perform(patch("/api/runs/wf-1")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"status":"running","currentStep":"write_chapter_1","metadata":{"attempt":2}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("RUNNING")));

        verify(runLedgerService).updateRun("wf-1",
                new RunUpdate(RunStatus.RUNNING, "write_chapter_1", null, Map.of("attempt", 2)));
    }

    @Test
    void updateRun_unknownStatus_returnsBadRequest() throws Exception {
        mockMvc.perform(patch("/api/runs/wf-1")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"status":"blocked"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Unknown run status: blocked")));
    }

    @Test
    void updateRun_unknownRun_returnsNotFound() throws Exception {
        when(runLedgerService.updateRun(eq("missing"), any())).thenThrow(new RunNotFoundException("missing"));

        mockMvc.perform(patch("/api/runs/missing")
                        .header("X-API-Key", API_KEY)
                        .contentType("application/json")
                        .content("""
                                {"status":"failed","errorMessage":"boom"}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void getRunSteps_listsRecordedSteps() throws Exception {
        LocalDateTime now = LocalDateTime.now();
        when(runLedgerService.findRun("wf-1")).thenReturn(Optional.of(run(RunStatus.RUNNING)));
        when(runLedgerService.getRunSteps("wf-1")).thenReturn(List.of(
                new StoryGenerationStep("wf-1", "generate_outline", StepStatus.COMPLETED, null, null, now, now, now, now),
                new StoryGenerationStep("wf-1", "write_chapter_1", StepStatus.FAILED, null, "timeout", now, now, now, now)));

        mockMvc.perform(get("/api/runs/wf-1/steps").header("X-API-Key", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].stepName", is("write_chapter_1")))
                .andExpect(jsonPath("$[1].errorMessage", is("timeout")));
    }

    @Test
    void getProgress_returnsCalculation() throws Exception {
        when(progressTrackerService.calculateProgress("wf-1")).thenReturn(new ProgressCalculation(
                20, 441, 90, 351, "write_chapter_3",
                List.of("generate_outline", "write_chapter_1", "write_chapter_2", "write_chapter_3"), 16, 5));

        mockMvc.perform(get("/api/runs/wf-1/progress").header("X-API-Key", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.completedPercentage", is(20)))
                .andExpect(jsonPath("$.totalSteps", is(16)))
                .andExpect(jsonPath("$.completedSteps", hasSize(4)));
    }

    @Test
    void getProgress_unknownRun_returnsNotFound() throws Exception {
        when(progressTrackerService.calculateProgress("missing")).thenThrow(new RunNotFoundException("missing"));

        mockMvc.perform(get("/api/runs/missing/progress").header("X-API-Key", API_KEY))
                .andExpect(status().isNotFound());
    }

    @Test
    void refreshProgress_exhaustedRetries_returnsServiceUnavailable() throws Exception {
        doThrow(new ProgressUpdateException("wf-1", 4, new QueryTimeoutException("timeout")))
                .when(progressTrackerService).updateStoryProgress("wf-1");

        mockMvc.perform(post("/api/runs/wf-1/progress").header("X-API-Key", API_KEY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error", is("Failed to update progress for run wf-1 after 4 attempts")));
    }

    private static StoryGenerationRun run(RunStatus status) {
        LocalDateTime now = LocalDateTime.now();
        return new StoryGenerationRun("wf-1", "story-1", "exec-3", status, null, null, Map.of(), now, null, now, now);
    }
}
