package org.example.storybook.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.entity.RunStatus;
import org.example.storybook.entity.StepStatus;
import org.example.storybook.entity.StoryGenerationRunEntity;
import org.example.storybook.entity.StoryGenerationStepEntity;
import org.example.storybook.model.RunUpdate;
import org.example.storybook.model.StepResult;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.model.StoryGenerationStep;
import org.example.storybook.repository.StoryGenerationRunRepository;
import org.example.storybook.repository.StoryGenerationStepRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persisted record of generation runs and the steps recorded against them.
 * <p>
 * Operations do not retry; transient persistence errors propagate to the caller.
 */
@Service
public class RunLedgerService {

    private static final Logger log = LoggerFactory.getLogger(RunLedgerService.class);
    private static final int MAX_CREATE_ATTEMPTS = 3;
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final StoryGenerationRunRepository runRepository;
    private final StoryGenerationStepRepository stepRepository;
    private final ObjectMapper objectMapper;

    public RunLedgerService(
            StoryGenerationRunRepository runRepository,
            StoryGenerationStepRepository stepRepository,
            ObjectMapper objectMapper) {
        this.runRepository = runRepository;
        this.stepRepository = stepRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the queued or running run of the story, creating a queued one if there is none.
     */
    public StoryGenerationRun createOrGetRun(String storyId) {
        requireText(storyId, "storyId");
        for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
            Optional<StoryGenerationRunEntity> active = runRepository.findByActiveStoryId(storyId);
            if (active.isPresent()) {
                return toRun(active.get());
            }
            try {
                StoryGenerationRunEntity created = runRepository.saveAndFlush(
                        new StoryGenerationRunEntity(UUID.randomUUID().toString(), storyId));
                log.info("Created generation run {} for story {}", created.getRunId(), storyId);
                return toRun(created);
            } catch (DataIntegrityViolationException e) {
                log.debug("Active run for story {} already exists (race condition handled)", storyId);
            }
        }
        return runRepository.findByActiveStoryId(storyId)
                .map(this::toRun)
                .orElseThrow(() -> new IllegalStateException("Could not create or find an active run for story " + storyId));
    }

    /**
     * Variant for triggers that assign their own run id. An existing run with that id is returned as is;
     * otherwise any other active run of the story is cancelled as superseded and the new run is inserted.
     */
    public StoryGenerationRun createOrGetRun(String storyId, String runId, String workflowExecution) {
        requireText(storyId, "storyId");
        if (runId == null || runId.isBlank()) {
            return createOrGetRun(storyId);
        }

        Optional<StoryGenerationRunEntity> existing = runRepository.findById(runId);
        if (existing.isPresent()) {
            StoryGenerationRunEntity run = existing.get();
            if (!storyId.equals(run.getStoryId())) {
                throw new IllegalArgumentException("Run " + runId + " belongs to story " + run.getStoryId());
            }
            return toRun(run);
        }

        runRepository.findByActiveStoryId(storyId).ifPresent(previous -> {
            log.warn("Cancelling run {} for story {}: superseded by run {}", previous.getRunId(), storyId, runId);
            updateRun(previous.getRunId(), new RunUpdate(
                    RunStatus.CANCELLED, null, "Superseded by run " + runId, null));
        });

        StoryGenerationRunEntity run = new StoryGenerationRunEntity(runId, storyId);
        run.setWorkflowExecution(workflowExecution);
        try {
            StoryGenerationRunEntity created = runRepository.saveAndFlush(run);
            log.info("Created generation run {} for story {} (execution {})", runId, storyId, workflowExecution);
            return toRun(created);
        } catch (DataIntegrityViolationException e) {
            log.debug("Run {} was created concurrently (race condition handled)", runId);
            return runRepository.findById(runId)
                    .or(() -> runRepository.findByActiveStoryId(storyId))
                    .map(this::toRun)
                    .orElseThrow(() -> e);
        }
    }

    @Transactional
    public StoryGenerationRun updateRun(String runId, RunUpdate update) {
        StoryGenerationRunEntity run = runRepository.findById(runId)
                .orElseThrow(() -> new RunNotFoundException(runId));
        LocalDateTime now = LocalDateTime.now();

        if (update.status() != null) {
            RunStatus previous = run.getStatus();
            run.setStatus(update.status());
            if (update.status() == RunStatus.RUNNING && run.getStartedAt() == null) {
                run.setStartedAt(now);
            }
            if (update.status().isTerminal()) {
                run.setEndedAt(now);
            }
            if (previous != update.status()) {
                log.info("Run {} status {} -> {}", runId, previous, update.status());
            }
        }
        if (update.currentStep() != null) {
            run.setCurrentStep(truncate(update.currentStep(), 120));
        }
        if (update.errorMessage() != null) {
            run.setErrorMessage(update.errorMessage());
        }
        if (update.metadata() != null && !update.metadata().isEmpty()) {
            Map<String, Object> merged = readMetadata(run.getMetadataJson());
            merged.putAll(update.metadata());
            run.setMetadataJson(writeJson(merged));
        }
        run.setUpdatedAt(now);

        return toRun(runRepository.saveAndFlush(run));
    }

    public StoryGenerationRun getRun(String runId) {
        return findRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public Optional<StoryGenerationRun> findRun(String runId) {
        if (runId == null || runId.isBlank()) {
            return Optional.empty();
        }
        return runRepository.findById(runId).map(this::toRun);
    }

    public List<StoryGenerationRun> listRuns(String storyId) {
        return runRepository.findByStoryIdOrderByCreatedAtDesc(storyId).stream()
                .map(this::toRun)
                .toList();
    }

    /**
     * Upserts the step row. Replaying a step overwrites status, detail and error but keeps
     * the original creation time.
     */
    public void storeStepResult(String runId, String stepName, StepResult result) {
        requireText(stepName, "stepName");
        if (!runRepository.existsById(runId)) {
            throw new RunNotFoundException(runId);
        }
        try {
            writeStep(runId, stepName, result);
        } catch (DataIntegrityViolationException e) {
            log.debug("Step {}/{} was inserted concurrently (race condition handled)", runId, stepName);
            writeStep(runId, stepName, result);
        }
    }

    private void writeStep(String runId, String stepName, StepResult result) {
        StoryGenerationStepEntity step = stepRepository.findByRunIdAndStepName(runId, stepName)
                .orElseGet(() -> new StoryGenerationStepEntity(runId, stepName));
        LocalDateTime now = LocalDateTime.now();

        StepStatus status = result.status() != null ? result.status() : StepStatus.COMPLETED;
        step.setStatus(status);
        step.setDetailJson(result.result() != null ? writeJson(result.result()) : null);
        step.setErrorMessage(result.error());
        if (status == StepStatus.RUNNING) {
            step.setStartedAt(now);
            step.setEndedAt(null);
        } else if (status == StepStatus.COMPLETED || status == StepStatus.FAILED) {
            step.setEndedAt(now);
        }
        stepRepository.saveAndFlush(step);
        log.debug("Stored step {} for run {} with status {}", stepName, runId, status);
    }

    public List<StoryGenerationStep> getRunSteps(String runId) {
        return stepRepository.findByRunIdOrderByCreatedAtAscStepNameAsc(runId).stream()
                .map(this::toStep)
                .toList();
    }

    public List<StoryGenerationStep> getCompletedSteps(String runId) {
        return stepRepository.findByRunIdAndStatus(runId, StepStatus.COMPLETED).stream()
                .map(this::toStep)
                .toList();
    }

    public StoryGenerationStep getStepResult(String runId, String stepName) {
        return findStepResult(runId, stepName)
                .orElseThrow(() -> new StepNotFoundException(runId, stepName));
    }

    public Optional<StoryGenerationStep> findStepResult(String runId, String stepName) {
        return stepRepository.findByRunIdAndStepName(runId, stepName).map(this::toStep);
    }

    private StoryGenerationRun toRun(StoryGenerationRunEntity entity) {
        return new StoryGenerationRun(
                entity.getRunId(),
                entity.getStoryId(),
                entity.getWorkflowExecution(),
                entity.getStatus(),
                entity.getCurrentStep(),
                entity.getErrorMessage(),
                readMetadata(entity.getMetadataJson()),
                entity.getStartedAt(),
                entity.getEndedAt(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    private StoryGenerationStep toStep(StoryGenerationStepEntity entity) {
        return new StoryGenerationStep(
                entity.getRunId(),
                entity.getStepName(),
                entity.getStatus(),
                readDetail(entity.getDetailJson()),
                entity.getErrorMessage(),
                entity.getStartedAt(),
                entity.getEndedAt(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse run metadata JSON", e);
            return new LinkedHashMap<>();
        }
    }

    private JsonNode readDetail(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse step detail JSON", e);
            return null;
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize ledger payload", e);
        }
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
