package org.example.storybook.service.media;

import java.util.List;

/**
 * Object storage for generated images, books and audio.
 */
public interface AssetStorage {

    /**
     * Stores the bytes under {@code key}, replacing any previous object.
     *
     * @return the normalized key the object was stored under
     */
    String uploadFile(String key, byte[] data, String contentType);

    String getPublicUrl(String key);

    /**
     * Keys of all stored objects under the prefix, sorted.
     */
    List<String> listFiles(String prefix);

    byte[] downloadFile(String key);
}
