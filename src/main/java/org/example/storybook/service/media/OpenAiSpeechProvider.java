package org.example.storybook.service.media;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Narration through the OpenAI speech endpoint. Long chapters are split at sentence boundaries
 * and the MP3 segments are concatenated.
 */
@Service
public class OpenAiSpeechProvider implements SpeechProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSpeechProvider.class);
    static final int MAX_INPUT_CHARS = 4000;

    @Value("${tts.openai.api-key:}")
    private String apiKey;

    @Value("${tts.openai.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${tts.openai.model:gpt-4o-mini-tts}")
    private String model;

    @Value("${tts.openai.default-voice:fable}")
    private String defaultVoice;

    @Value("${tts.openai.instructions:Read warmly and clearly, like a storyteller reading to children.}")
    private String instructions;

    @Value("${tts.timeout-seconds:120}")
    private int timeoutSeconds;

    private WebClient webClient;

    @PostConstruct
    public void init() {
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .defaultHeader("Authorization", "Bearer " + apiKey)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
            .build();
        log.info("OpenAI speech provider initialized (configured: {})", isConfigured());
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String getProviderName() {
        return "openai-tts";
    }

    @Override
    public String getDefaultVoice() {
        return defaultVoice;
    }

    @Override
    public byte[] synthesize(String text, String voice) {
        if (!isConfigured()) {
            throw new IllegalStateException("OpenAI speech API key is not configured");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Nothing to narrate");
        }
        String resolvedVoice = voice != null && !voice.isBlank() ? voice : defaultVoice;

        List<String> segments = splitForSpeech(text, MAX_INPUT_CHARS);
        log.info("Generating speech for {} chars in {} segment(s) with voice={}",
                text.length(), segments.size(), resolvedVoice);

        ByteArrayOutputStream audio = new ByteArrayOutputStream();
        for (String segment : segments) {
            byte[] bytes = requestSpeech(segment, resolvedVoice);
            audio.writeBytes(bytes);
        }
        return audio.toByteArray();
    }

    private byte[] requestSpeech(String input, String voice) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("input", input);
        requestBody.put("voice", voice);
        requestBody.put("response_format", "mp3");
        if (instructions != null && !instructions.isBlank()) {
            requestBody.put("instructions", instructions);
        }

        try {
            byte[] audio = webClient.post()
                .uri("/audio/speech")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(byte[].class)
                .block(Duration.ofSeconds(timeoutSeconds));
            if (audio == null || audio.length == 0) {
                throw new IllegalStateException("OpenAI speech API returned no audio");
            }
            return audio;
        } catch (WebClientResponseException e) {
            log.error("OpenAI speech API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new IllegalStateException("OpenAI speech API error: " + e.getStatusCode(), e);
        }
    }

    static List<String> splitForSpeech(String text, int maxChars) {
        List<String> segments = new ArrayList<>();
        String remaining = text.trim();
        while (remaining.length() > maxChars) {
            int cut = lastSentenceBreak(remaining, maxChars);
            segments.add(remaining.substring(0, cut).trim());
            remaining = remaining.substring(cut).trim();
        }
        if (!remaining.isEmpty()) {
            segments.add(remaining);
        }
        return segments;
    }

    private static int lastSentenceBreak(String text, int maxChars) {
        for (int i = maxChars - 1; i > maxChars / 2; i--) {
            char c = text.charAt(i);
            if ((c == '.' || c == '!' || c == '?' || c == '\n') && i + 1 < text.length()) {
                return i + 1;
            }
        }
        int space = text.lastIndexOf(' ', maxChars);
        return space > 0 ? space : maxChars;
    }
}
