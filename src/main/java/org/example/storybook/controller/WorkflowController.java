package org.example.storybook.controller;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.example.storybook.config.RequestCorrelation;
import org.example.storybook.model.ConversationContext;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.service.ConversationContextManager;
import org.example.storybook.service.ResourceNotFoundException;
import org.example.storybook.service.workflow.AssemblyStepHandler;
import org.example.storybook.service.workflow.AudiobookResult;
import org.example.storybook.service.workflow.AudiobookStepHandler;
import org.example.storybook.service.workflow.ChapterStepHandler;
import org.example.storybook.service.workflow.ImageStepHandler;
import org.example.storybook.service.workflow.ImageTarget;
import org.example.storybook.service.workflow.OutlineStepHandler;
import org.example.storybook.service.workflow.RunCompletionService;
import org.example.storybook.service.workflow.StepTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Step endpoints called by the external workflow engine. Every step answers with
 * {@code success}, the step name and the ids it ran for, merged with the step's own result.
 */
@RestController
@RequestMapping("/api/workflow")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final OutlineStepHandler outlineStepHandler;
    private final ChapterStepHandler chapterStepHandler;
    private final ImageStepHandler imageStepHandler;
    private final AssemblyStepHandler assemblyStepHandler;
    private final AudiobookStepHandler audiobookStepHandler;
    private final RunCompletionService runCompletionService;
    private final ConversationContextManager contextManager;
    private final ObjectMapper objectMapper;

    public WorkflowController(
            OutlineStepHandler outlineStepHandler,
            ChapterStepHandler chapterStepHandler,
            ImageStepHandler imageStepHandler,
            AssemblyStepHandler assemblyStepHandler,
            AudiobookStepHandler audiobookStepHandler,
            RunCompletionService runCompletionService,
            ConversationContextManager contextManager,
            ObjectMapper objectMapper) {
        this.outlineStepHandler = outlineStepHandler;
        this.chapterStepHandler = chapterStepHandler;
        this.imageStepHandler = imageStepHandler;
        this.assemblyStepHandler = assemblyStepHandler;
        this.audiobookStepHandler = audiobookStepHandler;
        this.runCompletionService = runCompletionService;
        this.contextManager = contextManager;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/story-outline")
    public ResponseEntity<Map<String, Object>> storyOutline(
            @RequestBody OutlineRequest request,
            HttpServletRequest httpRequest) {
        return execute("story-outline", request.storyId(), request.workflowId(), httpRequest,
                trigger -> outlineStepHandler.generateOutline(trigger, request.prompt()));
    }

    @PostMapping("/chapter-writing")
    public ResponseEntity<Map<String, Object>> chapterWriting(
            @RequestBody ChapterRequest request,
            HttpServletRequest httpRequest) {
        Integer chapterNumber = request.resolveChapterNumber();
        if (chapterNumber == null || chapterNumber < 1) {
            return failure("chapter-writing", HttpStatus.BAD_REQUEST, "chapterNumber must be 1 or greater");
        }
        return execute("chapter-writing", request.storyId(), request.workflowId(), httpRequest,
                trigger -> chapterStepHandler.writeChapter(trigger, chapterNumber));
    }

    @PostMapping("/image-generation")
    public ResponseEntity<Map<String, Object>> imageGeneration(
            @RequestBody ImageRequest request,
            HttpServletRequest httpRequest) {
        ImageTarget target;
        try {
            target = ImageTarget.fromValue(request.imageType());
            target.stepName(request.chapterNumber());
        } catch (IllegalArgumentException e) {
            return failure("image-generation", HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return execute("image-generation", request.storyId(), request.workflowId(), httpRequest,
                trigger -> imageStepHandler.generateImage(
                        trigger, target, request.chapterNumber(), request.description(), request.style()));
    }

    @PostMapping("/final-production")
    public ResponseEntity<Map<String, Object>> finalProduction(
            @RequestBody StepRequest request,
            HttpServletRequest httpRequest) {
        return execute("final-production", request.storyId(), request.workflowId(), httpRequest,
                assemblyStepHandler::assemble);
    }

    /**
     * Narration is optional, so this endpoint reports success even when it fails.
     */
    @PostMapping("/audio-recording")
    public ResponseEntity<Map<String, Object>> audioRecording(
            @RequestBody AudioRequest request,
            HttpServletRequest httpRequest) {
        String step = "audio-recording";
        Map<String, Object> body = successBody(step, request.storyId(), request.workflowId());
        try {
            StepTrigger trigger = trigger(request.storyId(), request.workflowId(), httpRequest);
            AudiobookResult result = audiobookStepHandler.recordAudiobook(trigger, request.voice());
            body.putAll(toMap(result));
        } catch (RuntimeException e) {
            log.error("Workflow step {} failed for story {}; workflow continues", step, request.storyId(), e);
            body.put("audioUrl", null);
            body.put("error", e.getMessage() != null ? e.getMessage() : "Audio recording failed but workflow continues");
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/complete")
    public ResponseEntity<Map<String, Object>> complete(
            @RequestBody StepRequest request,
            HttpServletRequest httpRequest) {
        return execute("complete", request.storyId(), request.workflowId(), httpRequest,
                runCompletionService::complete);
    }

    @PostMapping("/fail")
    public ResponseEntity<Map<String, Object>> fail(@RequestBody FailRequest request) {
        String step = "fail";
        if (request.workflowId() == null || request.workflowId().isBlank()) {
            return failure(step, HttpStatus.BAD_REQUEST, "workflowId is required");
        }
        try {
            StoryGenerationRun run = runCompletionService.failRun(request.workflowId(), request.error());
            Map<String, Object> body = successBody(step, run.storyId(), run.runId());
            body.put("status", run.status());
            body.put("errorMessage", run.errorMessage());
            return ResponseEntity.ok(body);
        } catch (ResourceNotFoundException e) {
            return failure(step, HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping("/context/clear")
    public ResponseEntity<Map<String, Object>> clearContext(@RequestBody StepRequest request) {
        String step = "context-clear";
        if (request.storyId() == null || request.storyId().isBlank()
                || request.workflowId() == null || request.workflowId().isBlank()) {
            return failure(step, HttpStatus.BAD_REQUEST, "storyId and workflowId are required");
        }
        String contextId = ConversationContext.contextIdFor(request.storyId(), request.workflowId());
        contextManager.clearContext(contextId);
        Map<String, Object> body = successBody(step, request.storyId(), request.workflowId());
        body.put("contextId", contextId);
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<Map<String, Object>> execute(
            String step,
            String storyId,
            String workflowId,
            HttpServletRequest httpRequest,
            Function<StepTrigger, Object> action) {
        StepTrigger trigger;
        try {
            trigger = trigger(storyId, workflowId, httpRequest);
        } catch (IllegalArgumentException e) {
            return failure(step, HttpStatus.BAD_REQUEST, e.getMessage());
        }

        log.info("Workflow step {} started for story {} (workflow {})", step, storyId, workflowId);
        try {
            Object result = action.apply(trigger);
            Map<String, Object> body = successBody(step, storyId, workflowId);
            body.putAll(toMap(result));
            log.info("Workflow step {} completed for story {} (workflow {})", step, storyId, workflowId);
            return ResponseEntity.ok(body);
        } catch (ResourceNotFoundException e) {
            log.warn("Workflow step {} for story {}: {}", step, storyId, e.getMessage());
            return failure(step, HttpStatus.NOT_FOUND, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Workflow step {} failed for story {} (workflow {})", step, storyId, workflowId, e);
            return failure(step, HttpStatus.INTERNAL_SERVER_ERROR,
                    e.getMessage() != null ? e.getMessage() : "Unknown error");
        }
    }

    private StepTrigger trigger(String storyId, String workflowId, HttpServletRequest httpRequest) {
        return new StepTrigger(storyId, workflowId, RequestCorrelation.resolveWorkflowExecution(httpRequest));
    }

    private Map<String, Object> toMap(Object result) {
        if (result == null) {
            return Map.of();
        }
        return objectMapper.convertValue(result, MAP_TYPE);
    }

    private static Map<String, Object> successBody(String step, String storyId, String workflowId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("step", step);
        body.put("storyId", storyId);
        body.put("workflowId", workflowId);
        return body;
    }

    private static ResponseEntity<Map<String, Object>> failure(String step, HttpStatus status, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("step", step);
        body.put("error", error);
        return ResponseEntity.status(status).body(body);
    }

    public record StepRequest(String storyId, String workflowId) {}

    public record OutlineRequest(String storyId, String workflowId, String prompt) {}

    /**
     * {@code chapterIndex} is the zero-based form some workflow definitions send.
     */
    public record ChapterRequest(String storyId, String workflowId, Integer chapterNumber, Integer chapterIndex) {

        Integer resolveChapterNumber() {
            if (chapterNumber != null) {
                return chapterNumber;
            }
            return chapterIndex != null ? chapterIndex + 1 : null;
        }
    }

    public record ImageRequest(
            String storyId,
            String workflowId,
            String imageType,
            Integer chapterNumber,
            String description,
            String style) {}

    public record AudioRequest(String storyId, String workflowId, String voice) {}

    public record FailRequest(String storyId, String workflowId, String error) {}
}
