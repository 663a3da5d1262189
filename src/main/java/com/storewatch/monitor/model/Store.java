package com.storewatch.monitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Plain Java bean representing a row in the {@code stores} table.
 *
 * Stores are created outside this worker.  The worker only mutates the monitoring
 * columns: {@code baseline_url}, {@code failed_attempts}, {@code status} and
 * {@code last_checked}.  Each row is processed by at most one pipeline at a time, so
 * updates are plain single-row writes without locking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Store {

    private UUID id;

    /** Homepage URL as entered by the owner; may lack a scheme. */
    private String url;

    private StoreStatus status;

    /**
     * Public URL of the accepted reference screenshot.
     * Null until the first successful capture.
     */
    private String baselineUrl;

    /** Consecutive connectivity failures; reset to 0 on every successful capture. */
    private int failedAttempts;

    private Instant lastChecked;

    /** Recipient for alert e-mails, null when the owner has not set one. */
    private String ownerEmail;
}
