package com.storewatch.monitor.service;

import com.storewatch.monitor.client.ProbeClient;
import com.storewatch.monitor.client.ProbeResult;
import com.storewatch.monitor.config.MonitorProperties;
import com.storewatch.monitor.model.Alert;
import com.storewatch.monitor.model.AlertCategory;
import com.storewatch.monitor.model.AlertSeverity;
import com.storewatch.monitor.model.PingLog;
import com.storewatch.monitor.model.Store;
import com.storewatch.monitor.repository.AlertRepository;
import com.storewatch.monitor.repository.PingLogRepository;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Probes a store's homepage and raises an AVAILABILITY alert when the store is found
 * down twice in a row.
 *
 * A single failed probe is treated as noise.  While the store stays down every probe
 * alerts again, unless {@code monitor.ping-realert-cooldown} is set.  Probes never
 * touch the failure counter of the store; only visual captures do.
 */
@Singleton
public class AvailabilityProber {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityProber.class);

    private final ProbeClient probeClient;
    private final PingLogRepository pingLogRepository;
    private final AlertRepository alertRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final MonitorProperties properties;
    private final Clock clock;

    @Inject
    public AvailabilityProber(ProbeClient probeClient,
                              PingLogRepository pingLogRepository,
                              AlertRepository alertRepository,
                              NotificationDispatcher notificationDispatcher,
                              MonitorProperties properties,
                              Clock clock) {
        this.probeClient = probeClient;
        this.pingLogRepository = pingLogRepository;
        this.alertRepository = alertRepository;
        this.notificationDispatcher = notificationDispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Probes one store and records the result.
     *
     * @param store an ACTIVE store
     * @return the persisted probe record
     */
    public PingLog probe(Store store) {
        String url = StoreUrls.normalize(store.getUrl());
        Instant checkedAt = clock.instant();
        ProbeResult result = probeClient.probe(url);

        PingLog ping = PingLog.builder()
                .storeId(store.getId())
                .statusCode(result.statusCode())
                .responseTimeMs(result.responseTimeMs())
                .up(result.isUp())
                .errorMessage(result.error())
                .checkedAt(checkedAt)
                .build();
        pingLogRepository.save(ping);

        if (ping.isUp()) {
            log.info("Ping storeId={} url={} status={} responseTimeMs={}",
                    store.getId(), url, ping.getStatusCode(), ping.getResponseTimeMs());
            return ping;
        }

        log.warn("Ping down storeId={} url={} status={} responseTimeMs={} error={}",
                store.getId(), url, ping.getStatusCode(), ping.getResponseTimeMs(), ping.getErrorMessage());

        Optional<PingLog> previous = pingLogRepository.findPrevious(store.getId(), ping.getId());
        if (previous.isPresent() && !previous.get().isUp()) {
            raiseAvailabilityAlert(store, checkedAt);
        }
        return ping;
    }

    private void raiseAvailabilityAlert(Store store, Instant checkedAt) {
        if (withinCooldown(store, checkedAt)) {
            log.info("Availability alert suppressed by cooldown storeId={} cooldown={}",
                    store.getId(), properties.getPingRealertCooldown());
            return;
        }

        Alert alert = Alert.builder()
                .storeId(store.getId())
                .category(AlertCategory.AVAILABILITY)
                .severity(AlertSeverity.HIGH)
                .build();
        alertRepository.save(alert);

        log.warn("Availability alert raised storeId={} alertId={} url={}", store.getId(), alert.getId(), store.getUrl());
        notificationDispatcher.dispatch(store, alert);
    }

    private boolean withinCooldown(Store store, Instant checkedAt) {
        Duration cooldown = properties.getPingRealertCooldown();
        if (cooldown == null || cooldown.isZero() || cooldown.isNegative()) {
            return false;
        }
        return alertRepository.findLatestCreatedAt(store.getId(), AlertCategory.AVAILABILITY)
                .map(last -> last.isAfter(checkedAt.minus(cooldown)))
                .orElse(false);
    }
}
