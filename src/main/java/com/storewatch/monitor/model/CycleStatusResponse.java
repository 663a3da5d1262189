package com.storewatch.monitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Element of the {@code GET /api/cycles/status} response: one per monitoring cycle.
 * The last-run fields are absent until the cycle has completed once.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CycleStatusResponse(

        /** {@code visual} or {@code ping}. */
        @JsonProperty("cycle")
        String cycle,

        @JsonProperty("busy")
        boolean busy,

        @JsonProperty("lastStartedAt")
        Instant lastStartedAt,

        @JsonProperty("lastFinishedAt")
        Instant lastFinishedAt,

        @JsonProperty("lastListed")
        Integer lastListed,

        @JsonProperty("lastSucceeded")
        Integer lastSucceeded,

        @JsonProperty("lastFailed")
        Integer lastFailed
) {
}
