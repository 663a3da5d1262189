package com.storewatch.monitor.scheduler;

import com.storewatch.monitor.config.MonitorProperties;
import com.storewatch.monitor.model.CycleStatusResponse;
import com.storewatch.monitor.model.RunStatus;
import com.storewatch.monitor.model.Store;
import com.storewatch.monitor.repository.StoreRepository;
import com.storewatch.monitor.service.AvailabilityProber;
import com.storewatch.monitor.service.VisualCheckOutcome;
import com.storewatch.monitor.service.VisualCheckPipeline;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.TaskScheduler;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the two monitoring cycles and their schedules.
 *
 * <ul>
 *   <li><b>visual</b> – screenshot comparison of every active store, every
 *       {@code monitor.visual-period} with {@code monitor.inter-store-delay} between stores;</li>
 *   <li><b>ping</b> – availability probe of every active store, every
 *       {@code monitor.ping-period} with {@code monitor.ping-inter-store-delay} between stores.</li>
 * </ul>
 *
 * Both cycles fire immediately on {@link #start()} and then at a fixed rate on the
 * Micronaut scheduled executor.  A scheduled tick only claims its cycle and hands it to
 * the IO executor, so a tick that fires while the previous cycle still runs is dropped
 * instead of piling up behind it.  The cycles are independent: a long visual cycle
 * never delays a ping cycle, and a cycle never overlaps with itself.
 */
@Singleton
public class MonitorScheduler {

    private static final Logger log = LoggerFactory.getLogger(MonitorScheduler.class);

    static final String VISUAL = "visual";
    static final String PING = "ping";

    private final StoreRepository storeRepository;
    private final TaskScheduler taskScheduler;
    private final Executor cycleExecutor;
    private final MonitorProperties properties;

    private final CycleDriver visualDriver;
    private final CycleDriver pingDriver;

    private final List<ScheduledFuture<?>> schedules = new ArrayList<>();

    @Inject
    public MonitorScheduler(StoreRepository storeRepository,
                            VisualCheckPipeline visualCheckPipeline,
                            AvailabilityProber availabilityProber,
                            MonitorProperties properties,
                            @Named(TaskExecutors.SCHEDULED) TaskScheduler taskScheduler,
                            @Named(TaskExecutors.IO) Executor cycleExecutor,
                            Clock clock) {
        this.storeRepository = storeRepository;
        this.taskScheduler = taskScheduler;
        this.cycleExecutor = cycleExecutor;
        this.properties = properties;

        this.visualDriver = new CycleDriver(VISUAL,
                storeRepository::findActive,
                store -> {
                    VisualCheckOutcome outcome = visualCheckPipeline.process(store);
                    if (outcome == VisualCheckOutcome.RENDER_UNAVAILABLE) {
                        throw new CycleAbortedException("render service unavailable");
                    }
                    return outcome.runStatus() == RunStatus.SUCCESS;
                },
                properties.getInterStoreDelay(),
                clock);
        this.pingDriver = new CycleDriver(PING,
                storeRepository::findActive,
                store -> availabilityProber.probe(store).isUp(),
                properties.getPingInterStoreDelay(),
                clock);
    }

    // -----------------------------------------------------------------------
    // Lifecycle
    // -----------------------------------------------------------------------

    /**
     * Verifies that the store table is readable and registers both cycles.
     *
     * @throws MonitorStartupException when the active stores cannot be listed
     */
    public synchronized void start() {
        if (!schedules.isEmpty()) {
            log.warn("MonitorScheduler already started");
            return;
        }

        List<Store> active;
        try {
            active = storeRepository.findActive();
        } catch (RuntimeException e) {
            throw new MonitorStartupException("Could not list active stores", e);
        }

        Duration visualPeriod = properties.getVisualPeriod();
        Duration pingPeriod = properties.getPingPeriod();
        log.info("MonitorScheduler starting activeStores={} visualPeriod={} pingPeriod={}",
                active.size(), visualPeriod, pingPeriod);

        schedules.add(taskScheduler.scheduleAtFixedRate(Duration.ZERO, visualPeriod,
                () -> visualDriver.submit(cycleExecutor)));
        schedules.add(taskScheduler.scheduleAtFixedRate(Duration.ZERO, pingPeriod,
                () -> pingDriver.submit(cycleExecutor)));
    }

    /**
     * Cancels both schedules.  A cycle already running finishes its current store;
     * the executor itself is shut down by the application context.
     */
    @PreDestroy
    public synchronized void stop() {
        if (schedules.isEmpty()) {
            return;
        }
        for (ScheduledFuture<?> schedule : schedules) {
            schedule.cancel(false);
        }
        schedules.clear();
        log.info("MonitorScheduler stopped");
    }

    public synchronized boolean isStarted() {
        return !schedules.isEmpty();
    }

    // -----------------------------------------------------------------------
    // Manual triggers
    // -----------------------------------------------------------------------

    /**
     * Starts a visual cycle right away on its own thread.
     *
     * @return false when a visual cycle is already running
     */
    public boolean triggerVisual() {
        return trigger(visualDriver);
    }

    /**
     * Starts a ping cycle right away on its own thread.
     *
     * @return false when a ping cycle is already running
     */
    public boolean triggerPing() {
        return trigger(pingDriver);
    }

    private boolean trigger(CycleDriver driver) {
        boolean started = driver.submit(cycle -> {
            Thread thread = new Thread(cycle, "manual-" + driver.getName() + "-cycle");
            thread.setDaemon(true);
            thread.start();
        });
        if (started) {
            log.info("Manual {} cycle started", driver.getName());
        } else {
            log.info("Manual {} cycle refused, cycle already running", driver.getName());
        }
        return started;
    }

    // -----------------------------------------------------------------------
    // Status
    // -----------------------------------------------------------------------

    public List<CycleStatusResponse> status() {
        return List.of(toStatus(visualDriver), toStatus(pingDriver));
    }

    private static CycleStatusResponse toStatus(CycleDriver driver) {
        return driver.getLastReport()
                .map(r -> new CycleStatusResponse(driver.getName(), driver.isBusy(),
                        r.startedAt(), r.finishedAt(), r.listed(), r.succeeded(), r.failed()))
                .orElseGet(() -> new CycleStatusResponse(driver.getName(), driver.isBusy(),
                        null, null, null, null, null));
    }

    CycleDriver visualDriver() {
        return visualDriver;
    }

    CycleDriver pingDriver() {
        return pingDriver;
    }
}
