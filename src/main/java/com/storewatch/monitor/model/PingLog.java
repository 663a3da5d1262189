package com.storewatch.monitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One availability probe, stored in {@code ping_logs}. Rows are append-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PingLog {

    private Long id;

    private UUID storeId;

    /** HTTP status returned by the store, null on transport errors. */
    private Integer statusCode;

    private long responseTimeMs;

    private boolean up;

    private String errorMessage;

    private Instant checkedAt;
}
