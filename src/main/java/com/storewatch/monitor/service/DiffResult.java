package com.storewatch.monitor.service;

/**
 * Outcome of comparing a fresh capture with the baseline.
 *
 * @param significant      the change is large enough to alert on (or the comparison failed)
 * @param percentage       share of differing pixels, rounded to two decimals
 * @param dimensionChanged the two rasters differ in size; nothing was compared
 * @param comparisonFailed an input was missing or could not be decoded
 * @param failureReason    why the comparison failed, {@code null} otherwise
 * @param overlayPng       PNG-encoded highlight overlay, present only for significant diffs
 */
public record DiffResult(
        boolean significant,
        double percentage,
        boolean dimensionChanged,
        boolean comparisonFailed,
        String failureReason,
        byte[] overlayPng
) {

    public static DiffResult compared(boolean significant, double percentage, byte[] overlayPng) {
        return new DiffResult(significant, percentage, false, false, null, overlayPng);
    }

    public static DiffResult dimensionMismatch() {
        return new DiffResult(false, 0.0, true, false, null, null);
    }

    /** Fails closed: an unreadable comparison is reported as a full change. */
    public static DiffResult failed(String reason) {
        return new DiffResult(true, 100.0, false, true, reason, null);
    }

    public boolean hasOverlay() {
        return overlayPng != null && overlayPng.length > 0;
    }
}
