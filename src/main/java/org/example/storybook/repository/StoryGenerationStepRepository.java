package org.example.storybook.repository;

import org.example.storybook.entity.StepStatus;
import org.example.storybook.entity.StoryGenerationStepEntity;
import org.example.storybook.entity.StoryGenerationStepId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StoryGenerationStepRepository extends JpaRepository<StoryGenerationStepEntity, StoryGenerationStepId> {

    List<StoryGenerationStepEntity> findByRunIdOrderByCreatedAtAscStepNameAsc(String runId);

    List<StoryGenerationStepEntity> findByRunIdAndStatus(String runId, StepStatus status);

    Optional<StoryGenerationStepEntity> findByRunIdAndStepName(String runId, String stepName);
}
