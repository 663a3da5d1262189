package com.storewatch.monitor.service;

import java.time.Instant;
import java.util.UUID;

/**
 * Object key layout of the artifact bucket.
 *
 * <pre>
 *   screenshots/{storeId}/homepage-{timestamp}.png
 *   diffs/{storeId}/{timestamp}-diff.png
 * </pre>
 *
 * The timestamp is the ISO-8601 instant with {@code :} and {@code .} replaced by
 * {@code -}, e.g. {@code 2024-05-01T10-15-30-123Z}.
 */
public final class ArtifactKeys {

    private ArtifactKeys() {
    }

    public static String screenshot(UUID storeId, Instant capturedAt) {
        return "screenshots/" + storeId + "/homepage-" + timestamp(capturedAt) + ".png";
    }

    public static String diff(UUID storeId, Instant capturedAt) {
        return "diffs/" + storeId + "/" + timestamp(capturedAt) + "-diff.png";
    }

    static String timestamp(Instant instant) {
        return instant.toString().replace(':', '-').replace('.', '-');
    }
}
