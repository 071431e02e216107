package org.example.storybook.repository;

import org.example.storybook.entity.StoryEntity;
import org.example.storybook.entity.StoryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

@Repository
public interface StoryRepository extends JpaRepository<StoryEntity, String> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE StoryEntity s
            SET s.completionPercentage = :percentage,
                s.updatedAt = :now
            WHERE s.id = :storyId
            """)
    int updateCompletionPercentage(
            @Param("storyId") String storyId,
            @Param("percentage") int percentage,
            @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE StoryEntity s
            SET s.status = :status,
                s.updatedAt = :now
            WHERE s.id = :storyId
            """)
    int updateStatus(
            @Param("storyId") String storyId,
            @Param("status") StoryStatus status,
            @Param("now") LocalDateTime now);
}
