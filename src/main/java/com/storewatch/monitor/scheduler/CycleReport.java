package com.storewatch.monitor.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary of one completed cycle of a {@link CycleDriver}.
 *
 * @param cycle      driver name ({@code visual} or {@code ping})
 * @param startedAt  when the store list was requested
 * @param finishedAt when the last store was handled
 * @param listed     stores returned by the store source
 * @param succeeded  stores whose check ended well
 * @param failed     stores whose check ended in error (or threw)
 * @param completed  false when the cycle stopped early (source failure, interruption)
 */
public record CycleReport(
        String cycle,
        Instant startedAt,
        Instant finishedAt,
        int listed,
        int succeeded,
        int failed,
        boolean completed
) {

    public long durationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
