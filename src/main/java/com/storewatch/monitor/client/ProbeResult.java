package com.storewatch.monitor.client;

/**
 * Raw outcome of one availability request.
 *
 * @param statusCode     HTTP status, null when the request failed below HTTP
 * @param responseTimeMs wall-clock time until the status line (or the failure)
 * @param error          transport error text, null when a status was received
 */
public record ProbeResult(Integer statusCode, long responseTimeMs, String error) {

    /** Up means a 2xx answer; redirects are followed by the client before this check. */
    public boolean isUp() {
        return statusCode != null && statusCode >= 200 && statusCode < 300;
    }
}
