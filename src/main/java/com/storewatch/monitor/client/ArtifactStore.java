package com.storewatch.monitor.client;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * Blob storage for screenshots and diff overlays, readable through public URLs.
 */
public interface ArtifactStore {

    /**
     * Stores a PNG under the given key, replacing any previous object.
     *
     * @param key   object key, e.g. {@code screenshots/{storeId}/homepage-...png}
     * @param bytes PNG content
     * @return the public URL of the stored object
     */
    String put(String key, byte[] bytes);

    /**
     * Reads an object.
     *
     * @param key object key
     * @return the content, empty when the object is missing or cannot be read
     */
    Optional<byte[]> get(String key);

    /**
     * Derives the object key from a public URL produced by {@link #put}: the URL path
     * without its leading slash.
     *
     * @param publicUrl public URL, may be null
     * @return the key, empty for null, blank or malformed URLs
     */
    default Optional<String> keyFromPublicUrl(String publicUrl) {
        if (publicUrl == null || publicUrl.isBlank()) {
            return Optional.empty();
        }
        try {
            String path = new URI(publicUrl).getPath();
            if (path == null || path.length() <= 1) {
                return Optional.empty();
            }
            return Optional.of(path.substring(1));
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }
}
