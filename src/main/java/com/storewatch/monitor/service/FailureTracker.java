package com.storewatch.monitor.service;

import com.storewatch.monitor.config.MonitorProperties;
import com.storewatch.monitor.model.Store;
import com.storewatch.monitor.model.StoreStatus;
import com.storewatch.monitor.repository.StoreRepository;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the consecutive connectivity-failure counter of each store and deactivates
 * stores that stay unreachable.
 *
 * The counter is read from the database rather than from the {@link Store} snapshot,
 * so a reset made earlier in the same cycle is honoured.  Deactivation is one-way;
 * reactivating a store happens outside this worker.
 */
@Singleton
public class FailureTracker {

    private static final Logger log = LoggerFactory.getLogger(FailureTracker.class);

    private final StoreRepository storeRepository;
    private final MonitorProperties properties;

    @Inject
    public FailureTracker(StoreRepository storeRepository, MonitorProperties properties) {
        this.storeRepository = storeRepository;
        this.properties = properties;
    }

    /**
     * Counts one more connectivity failure for the store.
     *
     * @param store the store that could not be reached
     * @return the new consecutive-failure count
     */
    public int recordConnectivityFailure(Store store) {
        int attempts = storeRepository.findFailedAttempts(store.getId()) + 1;

        if (attempts >= properties.getMaxConsecutiveFailures()) {
            storeRepository.markInactive(store.getId(), attempts);
            store.setStatus(StoreStatus.INACTIVE);
            log.warn("Store deactivated after consecutive failures storeId={} url={} failedAttempts={}",
                    store.getId(), store.getUrl(), attempts);
        } else {
            storeRepository.updateFailedAttempts(store.getId(), attempts);
            log.info("Connectivity failure recorded storeId={} failedAttempts={}/{}",
                    store.getId(), attempts, properties.getMaxConsecutiveFailures());
        }

        store.setFailedAttempts(attempts);
        return attempts;
    }

    /**
     * Clears the failure counter after the store answered.
     *
     * @param store the store that was reached
     */
    public void recordSuccess(Store store) {
        storeRepository.updateFailedAttempts(store.getId(), 0);
        store.setFailedAttempts(0);
    }
}
