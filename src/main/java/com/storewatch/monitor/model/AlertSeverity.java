package com.storewatch.monitor.model;

/**
 * Severity tier shown on the dashboard and in alert e-mails.
 */
public enum AlertSeverity {

    HIGH,
    LOW;

    /**
     * Classifies a visual diff: anything strictly above {@code highThresholdPercent} is HIGH.
     *
     * @param diffPercentage       rounded diff percentage of the alert
     * @param highThresholdPercent boundary between LOW and HIGH
     * @return the severity tier
     */
    public static AlertSeverity forDiffPercentage(double diffPercentage, double highThresholdPercent) {
        return diffPercentage > highThresholdPercent ? HIGH : LOW;
    }
}
