package com.storewatch.monitor.scheduler;

/**
 * Thrown by a per-store action when the remaining stores of the cycle cannot be
 * checked either, for example because a shared dependency is down.
 */
public class CycleAbortedException extends RuntimeException {

    public CycleAbortedException(String message) {
        super(message);
    }
}
