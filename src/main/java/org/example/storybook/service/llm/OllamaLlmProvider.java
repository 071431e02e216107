package org.example.storybook.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LLM provider for Ollama.
 * Single-shot calls use /api/generate; conversations use /api/chat with the message
 * history kept in an in-process {@link ChatSession}.
 */
public class OllamaLlmProvider implements ConversationalLlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds) {
        this(WebClient.builder().baseUrl(baseUrl).build(), model, timeoutSeconds);
        log.info("Ollama LLM provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    OllamaLlmProvider(WebClient webClient, String model, int timeoutSeconds) {
        this.webClient = webClient;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        Map<String, Object> requestBody = Map.of(
                "model", model,
                "prompt", prompt,
                "stream", false,
                "options", toOllamaOptions(options)
        );

        JsonNode responseNode = post("/api/generate", requestBody);
        JsonNode response = responseNode.get("response");
        return response != null ? response.asText() : "";
    }

    @Override
    public ConversationTurn continueConversation(
            String systemPrompt,
            ProviderContinuation continuation,
            String prompt,
            LlmOptions options) {
        ChatSession session = resolveSession(systemPrompt, continuation);
        session.append(ChatMessage.user(prompt));

        List<Map<String, String>> messages = session.snapshot().stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList();
        Map<String, Object> requestBody = Map.of(
                "model", model,
                "messages", messages,
                "stream", false,
                "options", toOllamaOptions(options)
        );

        String text;
        try {
            JsonNode responseNode = post("/api/chat", requestBody);
            JsonNode message = responseNode.get("message");
            text = message != null && message.has("content") ? message.get("content").asText() : "";
        } catch (LlmProviderException e) {
            session.discardLastUserTurn();
            throw e;
        }

        if (text.isBlank()) {
            session.discardLastUserTurn();
        } else {
            session.append(ChatMessage.assistant(text));
        }
        return new ConversationTurn(text, new ChatSessionContinuation(session));
    }

    private ChatSession resolveSession(String systemPrompt, ProviderContinuation continuation) {
        if (continuation instanceof ChatSessionContinuation chat && chat.isLive()) {
            chat.session().updateSystemPrompt(systemPrompt);
            return chat.session();
        }
        if (continuation != null && continuation.kind() == ContinuationKind.CHAT_SESSION) {
            log.warn("Ollama chat session was lost (process restart?), starting a new session");
        }
        return new ChatSession(systemPrompt);
    }

    private Map<String, Object> toOllamaOptions(LlmOptions options) {
        Map<String, Object> ollamaOptions = new HashMap<>();
        ollamaOptions.put("temperature", options.temperature());
        if (options.topP() != null) {
            ollamaOptions.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            ollamaOptions.put("num_predict", options.maxTokens());
        }
        return ollamaOptions;
    }

    private JsonNode post(String uri, Map<String, Object> requestBody) {
        try {
            String response = webClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
            return objectMapper.readTree(response);
        } catch (WebClientResponseException e) {
            log.error("Ollama API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException(getProviderName(), "Ollama API error: " + e.getStatusCode(), e);
        } catch (Exception e) {
            log.error("Failed to generate response from Ollama", e);
            throw new LlmProviderException(getProviderName(), "Failed to generate response from Ollama", e);
        }
    }

    @Override
    public ContinuationKind continuationKind() {
        return ContinuationKind.CHAT_SESSION;
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(2));
            return true;
        } catch (Exception e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }
}
