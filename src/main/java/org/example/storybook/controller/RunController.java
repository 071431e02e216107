package org.example.storybook.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.storybook.config.RequestCorrelation;
import org.example.storybook.entity.RunStatus;
import org.example.storybook.model.ProgressCalculation;
import org.example.storybook.model.RunUpdate;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.model.StoryGenerationStep;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.ProgressUpdateException;
import org.example.storybook.service.RunLedgerService;
import org.example.storybook.service.RunNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunLedgerService runLedgerService;
    private final ProgressTrackerService progressTrackerService;

    public RunController(RunLedgerService runLedgerService, ProgressTrackerService progressTrackerService) {
        this.runLedgerService = runLedgerService;
        this.progressTrackerService = progressTrackerService;
    }

    @PostMapping
    public ResponseEntity<?> createOrGetRun(@RequestBody CreateRunRequest request, HttpServletRequest httpRequest) {
        if (request.storyId() == null || request.storyId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "storyId is required"));
        }
        String execution = request.workflowExecution() != null
                ? request.workflowExecution()
                : RequestCorrelation.resolveWorkflowExecution(httpRequest);
        try {
            return ResponseEntity.ok(runLedgerService.createOrGetRun(request.storyId(), request.runId(), execution));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{runId}")
    public ResponseEntity<StoryGenerationRun> getRun(@PathVariable String runId) {
        return runLedgerService.findRun(runId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PatchMapping("/{runId}")
    public ResponseEntity<?> updateRun(@PathVariable String runId, @RequestBody UpdateRunRequest request) {
        RunStatus status;
        try {
            status = request.status() != null ? RunStatus.valueOf(request.status().trim().toUpperCase(Locale.ROOT)) : null;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown run status: " + request.status()));
        }
        try {
            RunUpdate update = new RunUpdate(status, request.currentStep(), request.errorMessage(), request.metadata());
            return ResponseEntity.ok(runLedgerService.updateRun(runId, update));
        } catch (RunNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping("/{runId}/steps")
    public ResponseEntity<List<StoryGenerationStep>> getRunSteps(@PathVariable String runId) {
        if (runLedgerService.findRun(runId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(runLedgerService.getRunSteps(runId));
    }

    @GetMapping("/{runId}/steps/{stepName}")
    public ResponseEntity<StoryGenerationStep> getStep(@PathVariable String runId, @PathVariable String stepName) {
        return runLedgerService.findStepResult(runId, stepName)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{runId}/progress")
    public ResponseEntity<ProgressCalculation> getProgress(@PathVariable String runId) {
        try {
            return ResponseEntity.ok(progressTrackerService.calculateProgress(runId));
        } catch (RunNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Recomputes progress and writes it to the story.
     */
    @PostMapping("/{runId}/progress")
    public ResponseEntity<?> refreshProgress(@PathVariable String runId) {
        try {
            progressTrackerService.updateStoryProgress(runId);
            return ResponseEntity.ok(progressTrackerService.calculateProgress(runId));
        } catch (RunNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (ProgressUpdateException e) {
            log.warn("Progress refresh for run {} failed: {}", runId, e.getMessage());
            return ResponseEntity.status(503).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/story/{storyId}")
    public List<StoryGenerationRun> listRuns(@PathVariable String storyId) {
        return runLedgerService.listRuns(storyId);
    }

    public record CreateRunRequest(String storyId, String runId, String workflowExecution) {}

    public record UpdateRunRequest(
            String status,
            String currentStep,
            String errorMessage,
            Map<String, Object> metadata) {}
}
