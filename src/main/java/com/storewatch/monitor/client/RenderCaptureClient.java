package com.storewatch.monitor.client;

/**
 * Remote browser that renders a page and returns a full-page PNG.
 */
public interface RenderCaptureClient {

    /**
     * Captures the page described by the request.  Blocks until the screenshot is
     * available or the request timeout has passed.
     *
     * @param request what to capture and how
     * @return PNG bytes, never empty
     * @throws CaptureException when navigation or rendering failed
     */
    byte[] capture(CaptureRequest request) throws CaptureException;
}
