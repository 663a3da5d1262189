package com.storewatch.monitor.service;

import com.storewatch.monitor.model.Alert;
import com.storewatch.monitor.model.Store;

/**
 * Delivers a freshly inserted alert to the owner of the store.
 *
 * Implementations never throw: a lost notification must not fail the check that
 * raised the alert.
 */
public interface NotificationDispatcher {

    void dispatch(Store store, Alert alert);
}
