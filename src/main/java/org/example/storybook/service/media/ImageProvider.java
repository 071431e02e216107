package org.example.storybook.service.media;

/**
 * Text-to-image backend.
 */
public interface ImageProvider {

    /**
     * @return encoded image bytes (PNG)
     * @throws ImageGenerationException if the backend fails or produces no image
     */
    byte[] generate(String prompt, ImageOptions options);

    boolean isAvailable();

    String getProviderName();
}
