package org.example.storybook.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.LocalDateTime;

@Entity
@Table(name = "conversation_contexts")
public class ConversationContextEntity {

    @Id
    @Column(name = "context_id", length = 160)
    private String contextId;

    @Column(name = "story_id", nullable = false, length = 64)
    private String storyId;

    @Column(name = "system_prompt", columnDefinition = "TEXT")
    private String systemPrompt;

    // provider key -> serialized continuation
    @Column(name = "provider_data_json", columnDefinition = "TEXT")
    private String providerDataJson;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public ConversationContextEntity() {
    }

    public ConversationContextEntity(String contextId, String storyId) {
        this.contextId = contextId;
        this.storyId = storyId;
    }

    @PrePersist
    @PreUpdate
    public void updateTimestamps() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    public String getContextId() {
        return contextId;
    }

    public String getStoryId() {
        return storyId;
    }

    public void setStoryId(String storyId) {
        this.storyId = storyId;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getProviderDataJson() {
        return providerDataJson;
    }

    public void setProviderDataJson(String providerDataJson) {
        this.providerDataJson = providerDataJson;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public long getVersion() {
        return version;
    }
}
