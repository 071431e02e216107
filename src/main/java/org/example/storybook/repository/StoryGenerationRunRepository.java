package org.example.storybook.repository;

import org.example.storybook.entity.StoryGenerationRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StoryGenerationRunRepository extends JpaRepository<StoryGenerationRunEntity, String> {

    Optional<StoryGenerationRunEntity> findByActiveStoryId(String storyId);

    List<StoryGenerationRunEntity> findByStoryIdOrderByCreatedAtDesc(String storyId);
}
