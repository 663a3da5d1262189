package com.storewatch.monitor.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ArtifactKeys and StoreUrls")
class ArtifactKeysTest {

    private static final UUID STORE_ID = UUID.fromString("0f6a7c1e-3b2d-4e5f-8a9b-1c2d3e4f5a6b");

    @Test
    @DisplayName("Screenshot key embeds a filesystem-safe timestamp")
    void screenshotKey() {
        String key = ArtifactKeys.screenshot(STORE_ID, Instant.parse("2024-05-01T10:15:30.123Z"));

        assertThat(key).isEqualTo("screenshots/" + STORE_ID + "/homepage-2024-05-01T10-15-30-123Z.png");
    }

    @Test
    @DisplayName("Diff key lives under diffs/")
    void diffKey() {
        String key = ArtifactKeys.diff(STORE_ID, Instant.parse("2024-05-01T10:15:30Z"));

        assertThat(key).isEqualTo("diffs/" + STORE_ID + "/2024-05-01T10-15-30Z-diff.png");
    }

    @ParameterizedTest
    @CsvSource({
            "shop.example.com,          https://shop.example.com",
            "https://shop.example.com,  https://shop.example.com",
            "http://shop.example.com,   http://shop.example.com",
            "'  shop.example.com/fr  ', https://shop.example.com/fr"
    })
    @DisplayName("Store URLs without scheme default to https")
    void normalise(String raw, String expected) {
        assertThat(StoreUrls.normalize(raw)).isEqualTo(expected);
    }
}
