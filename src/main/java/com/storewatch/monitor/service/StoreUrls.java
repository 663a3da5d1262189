package com.storewatch.monitor.service;

import java.util.Locale;

/**
 * Store URLs are entered by owners and often lack a scheme ({@code shop.example.com}).
 */
public final class StoreUrls {

    private StoreUrls() {
    }

    /**
     * @param url URL as stored on the store row
     * @return the URL itself when it starts with {@code http}, otherwise {@code https://} + url
     */
    public static String normalize(String url) {
        String trimmed = url == null ? "" : url.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("http")) {
            return trimmed;
        }
        return "https://" + trimmed;
    }
}
