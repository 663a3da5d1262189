package com.storewatch.monitor.service;

import com.storewatch.monitor.model.RunStatus;

/**
 * How one visual check of one store ended.
 */
public enum VisualCheckOutcome {

    /** First successful capture became the baseline. */
    BASELINE_CREATED(RunStatus.SUCCESS),

    /** The stored baseline could not be read back and was replaced. */
    BASELINE_RESET_MISSING(RunStatus.SUCCESS),

    /** The page size changed; the capture replaced the baseline without an alert. */
    BASELINE_RESET_DIMENSIONS(RunStatus.SUCCESS),

    ALERTED(RunStatus.SUCCESS),

    /** Small change; the capture became the new baseline. */
    BASELINE_ADVANCED(RunStatus.SUCCESS),

    /** Pixel-identical to the baseline. */
    UNCHANGED(RunStatus.SUCCESS),

    COMPARISON_FAILED(RunStatus.ERROR),

    CAPTURE_FAILED(RunStatus.ERROR),

    /** The render service could not be reached; the store itself was not judged. */
    RENDER_UNAVAILABLE(RunStatus.ERROR),

    /** Unexpected error after the capture (storage, database). */
    FAILED(RunStatus.ERROR);

    private final RunStatus runStatus;

    VisualCheckOutcome(RunStatus runStatus) {
        this.runStatus = runStatus;
    }

    public RunStatus runStatus() {
        return runStatus;
    }
}
