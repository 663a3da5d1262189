package com.storewatch.monitor.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Data;

import java.time.Duration;

/**
 * Tunables of the monitoring engine, bound from the {@code monitor.*} keys of
 * {@code application.yml} (each key can be overridden through the environment,
 * e.g. {@code MONITOR_DIFF_THRESHOLD_PERCENT}).
 */
@ConfigurationProperties("monitor")
@Data
public class MonitorProperties {

    /** A visual diff strictly above this percentage raises an alert. */
    private double diffThresholdPercent = 5.0;

    /** Visual alerts strictly above this percentage are HIGH severity. */
    private double highSeverityPercent = 20.0;

    /** Per-pixel perceptual tolerance handed to the pixel comparator (0..1). */
    private double pixelThreshold = 0.1;

    /** Consecutive connectivity failures after which a store is deactivated. */
    private int maxConsecutiveFailures = 5;

    private Duration visualPeriod = Duration.ofMinutes(15);

    private Duration pingPeriod = Duration.ofMinutes(5);

    private Duration captureTimeout = Duration.ofSeconds(45);

    private Duration probeTimeout = Duration.ofSeconds(10);

    /** Pause between two stores of a visual cycle (render service rate limit). */
    private Duration interStoreDelay = Duration.ofSeconds(5);

    private Duration pingInterStoreDelay = Duration.ZERO;

    /** When true a significant diff also becomes the new baseline. */
    private boolean advanceBaselineOnAlert = false;

    /** Minimum gap between two availability alerts of a store; zero disables it. */
    private Duration pingRealertCooldown = Duration.ZERO;

    private boolean overlayEnabled = true;

    private String dashboardUrl = "https://www.storewatch.io/dashboard";
}
