package com.storewatch.monitor.model;

/**
 * Outcome of a single visual pipeline execution as written to {@code runs.status}.
 */
public enum RunStatus {

    SUCCESS,
    ERROR
}
