package org.example.storybook.service.media;

/**
 * Text-to-speech backend producing MP3 audio.
 */
public interface SpeechProvider {

    /**
     * @param voice provider voice name; null or blank selects {@link #getDefaultVoice()}
     */
    byte[] synthesize(String text, String voice);

    String getDefaultVoice();

    boolean isConfigured();

    String getProviderName();
}
