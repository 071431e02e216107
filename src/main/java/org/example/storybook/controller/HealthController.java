package org.example.storybook.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.storybook.config.RequestCorrelation;
import org.example.storybook.service.llm.ConversationalLlmProvider;
import org.example.storybook.service.media.ImageProvider;
import org.example.storybook.service.media.SpeechProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
public class HealthController {

    private final ConversationalLlmProvider outlineProvider;
    private final ConversationalLlmProvider chapterProvider;
    private final ImageProvider imageProvider;
    private final SpeechProvider speechProvider;

    public HealthController(
            @Qualifier("outlineLlmProvider") ConversationalLlmProvider outlineProvider,
            @Qualifier("chapterLlmProvider") ConversationalLlmProvider chapterProvider,
            ImageProvider imageProvider,
            SpeechProvider speechProvider) {
        this.outlineProvider = outlineProvider;
        this.chapterProvider = chapterProvider;
        this.imageProvider = imageProvider;
        this.speechProvider = speechProvider;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        ProviderHealth providers = new ProviderHealth(
                outlineProvider.getProviderName(),
                outlineProvider.isAvailable(),
                chapterProvider.getProviderName(),
                chapterProvider.isAvailable(),
                imageProvider.isAvailable(),
                speechProvider.isConfigured()
        );
        boolean textAvailable = providers.outlineAvailable() && providers.chapterAvailable();
        return new HealthDetails(
                textAvailable && providers.imageAvailable() ? "ok" : "degraded",
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now(),
                providers
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            String requestId,
            LocalDateTime asOf,
            ProviderHealth providers
    ) {
    }

    public record ProviderHealth(
            String outlineProvider,
            boolean outlineAvailable,
            String chapterProvider,
            boolean chapterAvailable,
            boolean imageAvailable,
            boolean speechConfigured
    ) {
    }
}
