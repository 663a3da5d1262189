package com.storewatch.monitor.model;

/**
 * Lifecycle status of a monitored store.
 *
 * <ul>
 *   <li>ACTIVE   – included in both the visual and the ping cycle</li>
 *   <li>INACTIVE – excluded from all cycles; set by the failure tracker after too many
 *       consecutive connectivity failures and only cleared by an operator</li>
 * </ul>
 */
public enum StoreStatus {

    ACTIVE,
    INACTIVE
}
