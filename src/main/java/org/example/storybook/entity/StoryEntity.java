package org.example.storybook.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "stories")
public class StoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String plotDescription;

    @Column(columnDefinition = "TEXT")
    private String synopsis;

    private String place;

    private String targetAudience;

    private String novelStyle;

    private String graphicalStyle;

    @Column(length = 16)
    private String storyLanguage;

    private Integer chapterCount;

    @Column(nullable = false)
    private int completionPercentage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private StoryStatus status;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public StoryEntity() {}

    public StoryEntity(String title) {
        this.title = title;
        this.status = StoryStatus.DRAFT;
    }

    @PrePersist
    @PreUpdate
    public void updateTimestamps() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        if (status == null) {
            status = StoryStatus.DRAFT;
        }
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getPlotDescription() { return plotDescription; }
    public void setPlotDescription(String plotDescription) { this.plotDescription = plotDescription; }

    public String getSynopsis() { return synopsis; }
    public void setSynopsis(String synopsis) { this.synopsis = synopsis; }

    public String getPlace() { return place; }
    public void setPlace(String place) { this.place = place; }

    public String getTargetAudience() { return targetAudience; }
    public void setTargetAudience(String targetAudience) { this.targetAudience = targetAudience; }

    public String getNovelStyle() { return novelStyle; }
    public void setNovelStyle(String novelStyle) { this.novelStyle = novelStyle; }

    public String getGraphicalStyle() { return graphicalStyle; }
    public void setGraphicalStyle(String graphicalStyle) { this.graphicalStyle = graphicalStyle; }

    public String getStoryLanguage() { return storyLanguage; }
    public void setStoryLanguage(String storyLanguage) { this.storyLanguage = storyLanguage; }

    public Integer getChapterCount() { return chapterCount; }
    public void setChapterCount(Integer chapterCount) { this.chapterCount = chapterCount; }

    public int getCompletionPercentage() { return completionPercentage; }
    public void setCompletionPercentage(int completionPercentage) { this.completionPercentage = completionPercentage; }

    public StoryStatus getStatus() { return status; }
    public void setStatus(StoryStatus status) { this.status = status; }

    public LocalDateTime getCreatedAt() { return createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
