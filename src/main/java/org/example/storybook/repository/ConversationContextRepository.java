package org.example.storybook.repository;

import org.example.storybook.entity.ConversationContextEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ConversationContextRepository extends JpaRepository<ConversationContextEntity, String> {

    @Query("SELECT c.contextId FROM ConversationContextEntity c WHERE c.updatedAt < :cutoff")
    List<String> findStaleContextIds(@Param("cutoff") LocalDateTime cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            DELETE FROM ConversationContextEntity c
            WHERE c.updatedAt < :cutoff
            """)
    int deleteStale(@Param("cutoff") LocalDateTime cutoff);
}
