package org.example.storybook.controller;

import org.example.storybook.service.llm.ConversationalLlmProvider;
import org.example.storybook.service.media.ImageProvider;
import org.example.storybook.service.media.SpeechProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean(name = "outlineLlmProvider")
    private ConversationalLlmProvider outlineProvider;

    @MockitoBean(name = "chapterLlmProvider")
    private ConversationalLlmProvider chapterProvider;

    @MockitoBean
    private ImageProvider imageProvider;

    @MockitoBean
    private SpeechProvider speechProvider;

    @Test
    void health_isPublicAndOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("ok")));
    }

    @Test
    void healthDetails_imageBackendDown_reportsDegraded() throws Exception {
        when(outlineProvider.getProviderName()).thenReturn("xai");
        when(outlineProvider.isAvailable()).thenReturn(true);
        when(chapterProvider.getProviderName()).thenReturn("ollama");
        when(chapterProvider.isAvailable()).thenReturn(true);
        when(imageProvider.isAvailable()).thenReturn(false);
        when(speechProvider.isConfigured()).thenReturn(true);

        mockMvc.perform(get("/health/details").header("X-Request-Id", "req-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("degraded")))
                .andExpect(jsonPath("$.requestId", is("req-1")))
                .andExpect(jsonPath("$.providers.outlineProvider", is("xai")))
                .andExpect(jsonPath("$.providers.chapterProvider", is("ollama")))
                .andExpect(jsonPath("$.providers.speechConfigured", is(true)));
    }
}
