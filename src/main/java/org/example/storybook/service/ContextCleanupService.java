package org.example.storybook.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class ContextCleanupService {

    private static final Logger log = LoggerFactory.getLogger(ContextCleanupService.class);

    private final ConversationContextManager contextManager;
    private final boolean cleanupEnabled;
    private final Duration maxAge;

    public ContextCleanupService(
            ConversationContextManager contextManager,
            @Value("${context.cleanup.enabled:true}") boolean cleanupEnabled,
            @Value("${context.cleanup.max-age-hours:24}") int maxAgeHours) {
        this.contextManager = contextManager;
        this.cleanupEnabled = cleanupEnabled;
        this.maxAge = Duration.ofHours(Math.max(1, maxAgeHours));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void cleanupOnStartup() {
        cleanup();
    }

    @Scheduled(fixedDelayString = "${context.cleanup.interval-ms:3600000}",
            initialDelayString = "${context.cleanup.interval-ms:3600000}")
    public void cleanupPeriodically() {
        cleanup();
    }

    int cleanup() {
        if (!cleanupEnabled) {
            log.debug("Conversation context cleanup is disabled");
            return 0;
        }
        try {
            return contextManager.cleanupStaleContexts(maxAge);
        } catch (RuntimeException e) {
            log.error("Conversation context cleanup failed", e);
            return 0;
        }
    }
}
