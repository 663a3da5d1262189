package com.storewatch.monitor.model;

/**
 * What kind of problem an {@link Alert} reports.
 *
 * <ul>
 *   <li>VISUAL       - the homepage changed beyond the diff threshold</li>
 *   <li>AVAILABILITY - two or more consecutive ping probes failed</li>
 * </ul>
 */
public enum AlertCategory {

    VISUAL,
    AVAILABILITY
}
