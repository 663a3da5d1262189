package com.storewatch.monitor.scheduler;

/**
 * The monitor could not start; the process exits with a non-zero status.
 */
public class MonitorStartupException extends RuntimeException {

    public MonitorStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
