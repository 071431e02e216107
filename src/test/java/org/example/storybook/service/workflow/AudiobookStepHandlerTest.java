package org.example.storybook.service.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.storybook.entity.RunStatus;
import org.example.storybook.entity.StepStatus;
import org.example.storybook.model.BookOutline;
import org.example.storybook.model.RunUpdate;
import org.example.storybook.model.StepResult;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.model.StoryGenerationStep;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.RunLedgerService;
import org.example.storybook.service.media.AssetKeyService;
import org.example.storybook.service.media.AssetStorage;
import org.example.storybook.service.media.SpeechProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AudiobookStepHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private RunLedgerService runLedgerService;

    @Mock
    private ProgressTrackerService progressTracker;

    @Mock
    private SpeechProvider speechProvider;

    @Mock
    private AssetStorage assetStorage;

    private AudiobookStepHandler handler;

    @BeforeEach
    void setUp() {
        handler = new AudiobookStepHandler(
                runLedgerService,
                progressTracker,
                new OutlineParser(objectMapper),
                speechProvider,
                assetStorage,
                new AssetKeyService());
    }

    @Test
    void recordAudiobook_narratesWrittenChaptersAndSkipsMissingOnes() {
        stubRun();
        stubStep("generate_outline", objectMapper.valueToTree(outline()));
        stubStep("write_chapter_1", objectMapper.valueToTree(Map.of("content", "Pip woke up.")));
        when(runLedgerService.findStepResult("wf-1", "write_chapter_2")).thenReturn(Optional.empty());
        stubStep("write_chapter_3", objectMapper.valueToTree(Map.of("content", "Pip went home.")));
        when(speechProvider.isConfigured()).thenReturn(true);
        when(speechProvider.getDefaultVoice()).thenReturn("alloy");
        when(speechProvider.getProviderName()).thenReturn("openai");
        when(speechProvider.synthesize(anyString(), eq("alloy"))).thenReturn(new byte[] {1, 2, 3});
        when(assetStorage.uploadFile(anyString(), any(), eq("audio/mpeg")))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(assetStorage.getPublicUrl(anyString())).thenAnswer(invocation -> "/assets/" + invocation.getArgument(0));

        AudiobookResult result = handler.recordAudiobook(StepTrigger.of("story-1", "wf-1"), " ");

        assertEquals(2, result.chaptersProcessed());
        assertEquals("alloy", result.voice());
        assertNull(result.error());
        assertEquals(List.of(1, 3), List.copyOf(result.audioUrls().keySet()));
        assertEquals("/assets/stories/story-1/audio/alloy/chapter-1.mp3", result.audioUrl());
        verify(speechProvider).synthesize("The Egg.\n\nPip woke up.", "alloy");
        verify(runLedgerService).storeStepResult(eq("wf-1"), eq("generate_audiobook"),
                argThat(stored -> stored.status() == StepStatus.COMPLETED));
        verify(progressTracker).refreshQuietly("wf-1");
    }

    @Test
    void recordAudiobook_speechNotConfigured_recordsFailureWithoutFailingRun() {
        stubRun();
        when(speechProvider.isConfigured()).thenReturn(false);
        when(speechProvider.getProviderName()).thenReturn("openai");

        AudiobookResult result = handler.recordAudiobook(StepTrigger.of("story-1", "wf-1"), "nova");

        assertEquals("Speech provider openai is not configured", result.error());
        assertNull(result.audioUrl());
        assertTrue(result.audioUrls().isEmpty());
        verify(runLedgerService).storeStepResult("wf-1", "generate_audiobook",
                StepResult.failed("Speech provider openai is not configured"));
        verify(runLedgerService, never()).updateRun("wf-1", RunUpdate.failed("Speech provider openai is not configured"));
        verify(progressTracker).refreshQuietly("wf-1");
        verifyNoInteractions(assetStorage);
    }

    @Test
    void recordAudiobook_noChaptersWritten_reportsError() {
        stubRun();
        stubStep("generate_outline", objectMapper.valueToTree(outline()));
        when(runLedgerService.findStepResult(eq("wf-1"), startsWith("write_chapter_")))
                .thenReturn(Optional.empty());
        when(speechProvider.isConfigured()).thenReturn(true);

        AudiobookResult result = handler.recordAudiobook(StepTrigger.of("story-1", "wf-1"), "nova");

        assertEquals("No written chapters to narrate for run wf-1", result.error());
        verify(speechProvider, never()).synthesize(anyString(), anyString());
    }

    private void stubRun() {
        LocalDateTime now = LocalDateTime.now();
        StoryGenerationRun run = new StoryGenerationRun("wf-1", "story-1", null, RunStatus.RUNNING, "assemble",
                null, Map.of(), now, null, now, now);
        when(runLedgerService.createOrGetRun("story-1", "wf-1", null)).thenReturn(run);
        when(runLedgerService.updateRun(eq("wf-1"), any())).thenReturn(run);
    }

    private void stubStep(String name, JsonNode detail) {
        LocalDateTime now = LocalDateTime.now();
        when(runLedgerService.findStepResult("wf-1", name)).thenReturn(Optional.of(
                new StoryGenerationStep("wf-1", name, StepStatus.COMPLETED, detail, null, now, now, now, now)));
    }

    private static BookOutline outline() {
        return new BookOutline("Pip's Day", null, null, List.of(
                new BookOutline.Chapter(1, "The Egg", "Pip hatches.", null),
                new BookOutline.Chapter(2, "The Pond", "Pip swims.", null),
                new BookOutline.Chapter(3, "Home", "Pip goes home.", null)));
    }
}
