package org.example.storybook.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LLM provider for xAI (Grok).
 * Single-shot calls use /v1/chat/completions. Conversations use /v1/responses, chaining turns
 * through {@code previous_response_id} so the server holds the history.
 */
public class XaiLlmProvider implements ConversationalLlmProvider {

    private static final Logger log = LoggerFactory.getLogger(XaiLlmProvider.class);
    private static final String BASE_URL = "https://api.x.ai/v1";

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public XaiLlmProvider(String apiKey, String model, int timeoutSeconds) {
        this(WebClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build(), apiKey, model, timeoutSeconds);
        log.info("xAI LLM provider initialized: model={}", model);
    }

    XaiLlmProvider(WebClient webClient, String apiKey, String model, int timeoutSeconds) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("messages", List.of(
                Map.of("role", "user", "content", prompt)
        ));
        requestBody.put("temperature", options.temperature());
        if (options.topP() != null) {
            requestBody.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            requestBody.put("max_tokens", options.maxTokens());
        }

        JsonNode responseNode = post("/chat/completions", requestBody);
        JsonNode choices = responseNode.get("choices");
        if (choices != null && choices.isArray() && choices.size() > 0) {
            JsonNode message = choices.get(0).get("message");
            if (message != null && message.has("content")) {
                return message.get("content").asText();
            }
        }
        throw new LlmProviderException(getProviderName(), "Invalid response format from xAI API");
    }

    @Override
    public ConversationTurn continueConversation(
            String systemPrompt,
            ProviderContinuation continuation,
            String prompt,
            LlmOptions options) {
        List<Map<String, String>> input = new ArrayList<>();
        String previousResponseId = null;
        if (continuation instanceof ResponseIdContinuation responseId && responseId.isLive()) {
            previousResponseId = responseId.previousResponseId();
        } else if (systemPrompt != null && !systemPrompt.isBlank()) {
            input.add(Map.of("role", "system", "content", systemPrompt));
        }
        input.add(Map.of("role", "user", "content", prompt));

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("input", input);
        requestBody.put("store", true);
        requestBody.put("temperature", options.temperature());
        if (previousResponseId != null) {
            requestBody.put("previous_response_id", previousResponseId);
        }
        if (options.topP() != null) {
            requestBody.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            requestBody.put("max_output_tokens", options.maxTokens());
        }

        JsonNode responseNode = post("/responses", requestBody);
        String text = extractOutputText(responseNode);
        String responseId = responseNode.path("id").asText(null);

        // an empty turn must not advance the chain
        ProviderContinuation next = text.isBlank() || responseId == null
                ? (continuation != null ? continuation : StatelessContinuation.INSTANCE)
                : new ResponseIdContinuation(responseId);
        return new ConversationTurn(text, next);
    }

    private String extractOutputText(JsonNode responseNode) {
        JsonNode outputText = responseNode.get("output_text");
        if (outputText != null && outputText.isTextual() && !outputText.asText().isBlank()) {
            return outputText.asText();
        }
        StringBuilder text = new StringBuilder();
        JsonNode output = responseNode.get("output");
        if (output != null && output.isArray()) {
            for (JsonNode item : output) {
                if (!"message".equals(item.path("type").asText())) {
                    continue;
                }
                for (JsonNode content : item.path("content")) {
                    if ("output_text".equals(content.path("type").asText())) {
                        text.append(content.path("text").asText());
                    }
                }
            }
        }
        return text.toString();
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
            log.error("xAI API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException(getProviderName(), "xAI API error: " + e.getStatusCode(), e);
        } catch (Exception e) {
            log.error("Failed to generate response from xAI", e);
            throw new LlmProviderException(getProviderName(), "Failed to generate response from xAI", e);
        }
    }

    @Override
    public ContinuationKind continuationKind() {
        return ContinuationKind.RESPONSE_ID;
    }

    @Override
    public boolean isAvailable() {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("xAI not available: API key not configured");
            return false;
        }
        return true;
    }

    @Override
    public String getProviderName() {
        return "xai";
    }
}
