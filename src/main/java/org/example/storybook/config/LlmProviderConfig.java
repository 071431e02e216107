package org.example.storybook.config;

import org.example.storybook.service.llm.ConversationalLlmProvider;
import org.example.storybook.service.llm.OllamaLlmProvider;
import org.example.storybook.service.llm.XaiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LLM providers.
 * Outline and chapter writing get separate beans so they can use different backends.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    // Shared defaults
    @Value("${ai.text.provider:ollama}")
    private String textProvider;

    // Outline provider config (falls back to the shared text provider)
    @Value("${ai.outline.provider:${ai.text.provider:ollama}}")
    private String outlineProvider;

    @Value("${ai.outline.timeout-seconds:${ai.text.timeout-seconds:180}}")
    private int outlineTimeoutSeconds;

    @Value("${ai.outline.ollama.base-url:${ai.text.ollama.base-url:http://localhost:11434}}")
    private String outlineOllamaBaseUrl;

    @Value("${ai.outline.ollama.model:${ai.text.ollama.model:llama3.1:latest}}")
    private String outlineOllamaModel;

    @Value("${ai.outline.xai.api-key:${ai.text.xai.api-key:}}")
    private String outlineXaiApiKey;

    @Value("${ai.outline.xai.model:${ai.text.xai.model:grok-4-1-fast-reasoning}}")
    private String outlineXaiModel;

    // Chapter provider config
    @Value("${ai.chapter.provider:${ai.text.provider:ollama}}")
    private String chapterProvider;

    @Value("${ai.chapter.timeout-seconds:${ai.text.timeout-seconds:180}}")
    private int chapterTimeoutSeconds;

    @Value("${ai.chapter.ollama.base-url:${ai.text.ollama.base-url:http://localhost:11434}}")
    private String chapterOllamaBaseUrl;

    @Value("${ai.chapter.ollama.model:${ai.text.ollama.model:llama3.1:latest}}")
    private String chapterOllamaModel;

    @Value("${ai.chapter.xai.api-key:${ai.text.xai.api-key:}}")
    private String chapterXaiApiKey;

    @Value("${ai.chapter.xai.model:${ai.text.xai.model:grok-4-1-fast-non-reasoning}}")
    private String chapterXaiModel;

    @Bean
    @Qualifier("outlineLlmProvider")
    public ConversationalLlmProvider outlineLlmProvider() {
        log.info("Configuring outline LLM provider: {} (default text provider: {})", outlineProvider, textProvider);
        return createProvider(
                outlineProvider,
                outlineOllamaBaseUrl, outlineOllamaModel,
                outlineXaiApiKey, outlineXaiModel,
                outlineTimeoutSeconds,
                "outline"
        );
    }

    @Bean
    @Qualifier("chapterLlmProvider")
    public ConversationalLlmProvider chapterLlmProvider() {
        log.info("Configuring chapter LLM provider: {}", chapterProvider);
        return createProvider(
                chapterProvider,
                chapterOllamaBaseUrl, chapterOllamaModel,
                chapterXaiApiKey, chapterXaiModel,
                chapterTimeoutSeconds,
                "chapter"
        );
    }

    private ConversationalLlmProvider createProvider(
            String providerType,
            String ollamaBaseUrl, String ollamaModel,
            String xaiApiKey, String xaiModel,
            int timeoutSeconds,
            String purpose) {

        return switch (providerType.toLowerCase()) {
            case "ollama" -> {
                log.info("Creating Ollama provider for {}: baseUrl={}, model={}",
                        purpose, ollamaBaseUrl, ollamaModel);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
            case "xai" -> {
                if (xaiApiKey == null || xaiApiKey.isBlank()) {
                    log.warn("xAI API key not configured for {} provider, falling back to Ollama", purpose);
                    yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
                }
                log.info("Creating xAI provider for {}: model={}", purpose, xaiModel);
                yield new XaiLlmProvider(xaiApiKey, xaiModel, timeoutSeconds);
            }
            default -> {
                log.warn("Unknown provider type '{}' for {}, falling back to Ollama", providerType, purpose);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
        };
    }
}
