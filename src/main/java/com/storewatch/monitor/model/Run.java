package com.storewatch.monitor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One execution of the visual pipeline for one store, stored in {@code runs}.
 * Rows are append-only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Run {

    /** Surrogate key (BIGSERIAL), set on insert. */
    private Long id;

    private UUID storeId;

    private Instant startedAt;

    private Instant finishedAt;

    private RunStatus status;

    /** Null on success. */
    private String errorMessage;

    /** Public URL of the capture taken in this run, null when capture failed. */
    private String screenshotUrl;

    /** Rounded diff percentage, null when no comparison took place. */
    private Double diffPercentage;
}
