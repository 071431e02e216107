package org.example.storybook.service.media;

/**
 * Image size and file naming for one generation. Null dimensions use the provider defaults.
 */
public record ImageOptions(Integer width, Integer height, String filenamePrefix) {

    public static ImageOptions cover(String filenamePrefix) {
        return new ImageOptions(768, 1024, filenamePrefix);
    }

    public static ImageOptions illustration(String filenamePrefix) {
        return new ImageOptions(null, null, filenamePrefix);
    }
}
