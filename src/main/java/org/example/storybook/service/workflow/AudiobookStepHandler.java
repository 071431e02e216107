package org.example.storybook.service.workflow;

import org.example.storybook.model.BookOutline;
import org.example.storybook.model.StepName;
import org.example.storybook.model.StoryGenerationRun;
import org.example.storybook.service.ProgressTrackerService;
import org.example.storybook.service.RunLedgerService;
import org.example.storybook.service.media.AssetKeyService;
import org.example.storybook.service.media.AssetStorage;
import org.example.storybook.service.media.SpeechProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Narrates every written chapter to MP3. The audiobook is optional: a failure is recorded on the
 * step but never fails the run.
 */
@Service
public class AudiobookStepHandler extends AbstractStepHandler {

    private static final Logger log = LoggerFactory.getLogger(AudiobookStepHandler.class);

    private final SpeechProvider speechProvider;
    private final AssetStorage assetStorage;
    private final AssetKeyService assetKeyService;

    public AudiobookStepHandler(
            RunLedgerService runLedgerService,
            ProgressTrackerService progressTracker,
            OutlineParser outlineParser,
            SpeechProvider speechProvider,
            AssetStorage assetStorage,
            AssetKeyService assetKeyService) {
        super(runLedgerService, progressTracker, outlineParser);
        this.speechProvider = speechProvider;
        this.assetStorage = assetStorage;
        this.assetKeyService = assetKeyService;
    }

    public AudiobookResult recordAudiobook(StepTrigger trigger, String voice) {
        return runOptionalStep(trigger, StepName.AUDIOBOOK,
                run -> narrate(run, voice),
                e -> AudiobookResult.failed(errorMessage(e)));
    }

    private AudiobookResult narrate(StoryGenerationRun run, String requestedVoice) {
        if (!speechProvider.isConfigured()) {
            throw new IllegalStateException("Speech provider " + speechProvider.getProviderName() + " is not configured");
        }
        String voice = requestedVoice != null && !requestedVoice.isBlank()
                ? requestedVoice.trim()
                : speechProvider.getDefaultVoice();
        BookOutline outline = requireOutline(run.runId());

        Map<Integer, String> audioUrls = new LinkedHashMap<>();
        for (BookOutline.Chapter chapter : outline.chapters()) {
            Optional<String> content = writtenChapter(run.runId(), chapter.chapterNumber());
            if (content.isEmpty()) {
                log.debug("Skipping narration of chapter {} for run {}: not written", chapter.chapterNumber(), run.runId());
                continue;
            }
            byte[] audio = speechProvider.synthesize(chapter.chapterTitle() + ".\n\n" + content.get(), voice);
            String key = assetStorage.uploadFile(
                    assetKeyService.buildChapterAudioKey(run.storyId(), voice, chapter.chapterNumber()),
                    audio,
                    "audio/mpeg");
            audioUrls.put(chapter.chapterNumber(), assetStorage.getPublicUrl(key));
            log.info("Narrated chapter {} for run {} ({} bytes)", chapter.chapterNumber(), run.runId(), audio.length);
        }
        if (audioUrls.isEmpty()) {
            throw new IllegalStateException("No written chapters to narrate for run " + run.runId());
        }

        return new AudiobookResult(
                audioUrls.values().iterator().next(),
                audioUrls,
                voice,
                audioUrls.size(),
                speechProvider.getProviderName(),
                null);
    }
}
