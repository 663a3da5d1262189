package com.storewatch.monitor.scheduler;

import com.storewatch.monitor.model.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Drives one periodic check cycle over the active stores.
 *
 * A tick that finds the previous cycle still running is dropped, not queued.  The
 * guard is taken by the caller of {@link #tick()} or {@link #submit(Executor)}, so a
 * scheduler thread that only submits never queues a second cycle behind a running
 * one.  Stores are handled one after the other with a fixed pause in between; an
 * exception thrown for one store is logged and the cycle moves on to the next, except
 * {@link CycleAbortedException} which ends the cycle.
 */
public class CycleDriver {

    private static final Logger log = LoggerFactory.getLogger(CycleDriver.class);

    private final String name;
    private final Supplier<List<Store>> storeSource;
    private final Predicate<Store> action;
    private final Duration interItemDelay;
    private final Clock clock;

    private final AtomicBoolean busy = new AtomicBoolean(false);
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();
    private final AtomicLong skippedTicks = new AtomicLong();

    /**
     * @param name           cycle name used in logs and reports
     * @param storeSource    lists the stores of a cycle
     * @param action         checks one store; returns whether the check ended well
     * @param interItemDelay pause between two stores
     * @param clock          time source of the reports
     */
    public CycleDriver(String name,
                       Supplier<List<Store>> storeSource,
                       Predicate<Store> action,
                       Duration interItemDelay,
                       Clock clock) {
        this.name = name;
        this.storeSource = storeSource;
        this.action = action;
        this.interItemDelay = interItemDelay == null ? Duration.ZERO : interItemDelay;
        this.clock = clock;
    }

    /**
     * Runs a full cycle on the calling thread unless one is already running.
     *
     * @return false when the tick was skipped because the previous cycle is still busy
     */
    public boolean tick() {
        if (!acquire()) {
            return false;
        }
        runGuarded();
        return true;
    }

    /**
     * Claims the cycle on the calling thread and runs it on {@code executor}.
     *
     * @return false when the previous cycle is still busy or the executor refused the cycle
     */
    public boolean submit(Executor executor) {
        if (!acquire()) {
            return false;
        }
        try {
            executor.execute(this::runGuarded);
            return true;
        } catch (RejectedExecutionException e) {
            busy.set(false);
            log.warn("Cycle {} could not be started: {}", name, e.getMessage());
            return false;
        }
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }

    public boolean isBusy() {
        return busy.get();
    }

    public String getName() {
        return name;
    }

    public Optional<CycleReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    // -----------------------------------------------------------------------
    // Cycle body
    // -----------------------------------------------------------------------

    private boolean acquire() {
        if (busy.compareAndSet(false, true)) {
            return true;
        }
        skippedTicks.incrementAndGet();
        log.info("Cycle {} still running, tick skipped", name);
        return false;
    }

    private void runGuarded() {
        try {
            lastReport.set(runCycle());
        } finally {
            busy.set(false);
        }
    }

    private CycleReport runCycle() {
        Instant startedAt = clock.instant();

        List<Store> stores;
        try {
            stores = storeSource.get();
        } catch (Exception e) {
            log.error("Cycle {} could not list stores: {}", name, e.getMessage(), e);
            return new CycleReport(name, startedAt, clock.instant(), 0, 0, 0, false);
        }

        log.info("Cycle {} starting stores={}", name, stores.size());

        int succeeded = 0;
        int failed = 0;
        boolean completed = true;

        for (int i = 0; i < stores.size(); i++) {
            Store store = stores.get(i);
            try {
                if (action.test(store)) {
                    succeeded++;
                } else {
                    failed++;
                }
            } catch (CycleAbortedException e) {
                failed++;
                completed = false;
                log.error("Cycle {} aborted at storeId={} after {} of {} stores: {}",
                        name, store.getId(), i + 1, stores.size(), e.getMessage());
                break;
            } catch (Exception e) {
                failed++;
                log.error("Cycle {} failed for storeId={} url={}: {}",
                        name, store.getId(), store.getUrl(), e.getMessage(), e);
            }

            if (i < stores.size() - 1 && !pause()) {
                log.warn("Cycle {} interrupted after {} of {} stores", name, i + 1, stores.size());
                completed = false;
                break;
            }
        }

        CycleReport report = new CycleReport(name, startedAt, clock.instant(),
                stores.size(), succeeded, failed, completed);
        log.info("Cycle {} completed stores={} succeeded={} failed={} durationMs={}",
                name, report.listed(), report.succeeded(), report.failed(), report.durationMs());
        return report;
    }

    private boolean pause() {
        if (interItemDelay.isZero() || interItemDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(interItemDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
