package com.storewatch.monitor.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Everything the render service needs to take a clean full-page screenshot.
 *
 * The request is protocol-neutral: how the headers, the user agent, the resource
 * blocklist and the style injection reach the browser is up to the
 * {@link RenderCaptureClient} implementation.
 */
public record CaptureRequest(

        String url,

        int viewportWidth,

        int viewportHeight,

        /** Navigation bound; the capture is abandoned and reported as failed past it. */
        Duration timeout,

        String userAgent,

        Map<String, String> extraHeaders,

        /** Browser resource types that are aborted instead of loaded. */
        List<String> rejectedResourceTypes,

        /** Style sheet injected before the screenshot to hide consent and chat overlays. */
        String hideOverlaysCss,

        /** Wait after network idle so late animations settle. */
        Duration settleDelay

) {

    public static final String USER_AGENT =
            "Mozilla/5.0 (compatible; StoreWatch Bot/1.0; +https://storewatch.io/bot)";

    /** Wait after network idle applied to every homepage capture. */
    public static final Duration SETTLE_DELAY = Duration.ofSeconds(5);

    static final String HIDE_OVERLAYS_CSS = """
            [id*="cookie"], [class*="cookie"], [class*="gdpr"], [class*="consent"],
            [class*="banner"], [class*="popup"], [class*="modal"], [class*="overlay"],
            [class*="chat"], [id*="chat"], [id*="intercom"], [class*="widget"],
            .cookie-notice, .cookie-consent, .cookie-law, .cookie-message,
            .cc-window, .cc-banner, .cc-compliance, .cc-floating, .cc-revoke,
            iframe[src*="cookie"], iframe[src*="consent"], [data-cookie],
            [data-gdpr], [data-consent], [data-tracking], [data-analytics],
            .popup-wrapper, .popup-container, .modal-backdrop, .backdrop,
            .notification-bar, .alert-bar, .top-bar, .bottom-bar,
            .newsletter-popup, .exit-intent, .scroll-popup, .float-chat {
              display: none !important;
              visibility: hidden !important;
              opacity: 0 !important;
              pointer-events: none !important;
              height: 0 !important;
              width: 0 !important;
              max-height: 0 !important;
              max-width: 0 !important;
              overflow: hidden !important;
            }
            """;

    /**
     * Builds the standard homepage capture: 1280x800 viewport, bot identity headers,
     * fonts and media blocked, overlays hidden, five seconds of settling.
     *
     * @param url     absolute homepage URL
     * @param timeout navigation timeout
     * @return the request
     */
    public static CaptureRequest homepage(String url, Duration timeout) {
        return new CaptureRequest(
                url,
                1280,
                800,
                timeout,
                USER_AGENT,
                Map.of("X-StoreWatch-Monitor", "true",
                        "X-Purpose", "Uptime Monitoring with consent"),
                List.of("font", "media"),
                HIDE_OVERLAYS_CSS,
                SETTLE_DELAY);
    }
}
