package com.storewatch.monitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * An alert raised by the worker, stored in {@code alerts}.
 *
 * Alerts are immutable from the worker's point of view; acknowledging or resolving
 * them happens in the dashboard.  The screenshot URLs and the diff percentage are only
 * populated for {@link AlertCategory#VISUAL} alerts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    public static final String STEP_HOMEPAGE = "homepage";

    private UUID id;

    private UUID storeId;

    private AlertCategory category;

    /** Page that was checked, {@value #STEP_HOMEPAGE} for visual alerts. */
    private String step;

    private String beforeUrl;

    private String afterUrl;

    /** Highlighted overlay; null when it could not be produced. */
    private String diffUrl;

    private Double diffPercentage;

    private AlertSeverity severity;

    private Instant createdAt;
}
