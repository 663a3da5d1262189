package com.storewatch.monitor;

import com.storewatch.monitor.scheduler.MonitorScheduler;
import io.micronaut.context.ApplicationContext;
import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the StoreWatch monitoring worker.
 *
 * The worker checks every active store for visual changes of its homepage and for
 * availability, records each check and alerts the store owner.  The HTTP server only
 * carries the health and manual-trigger endpoints.
 *
 * A termination signal closes the application context, which cancels the cycles and
 * closes every client and the connection pool, and the process exits with status 0
 * (see {@link ShutdownHandler}).  A failed startup exits with status 1.
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        log.info("Starting StoreWatch monitor...");
        ApplicationContext context = Micronaut.run(Application.class, args);
        ShutdownHandler shutdownHandler = ShutdownHandler.install(context);

        try {
            context.getBean(MonitorScheduler.class).start();
        } catch (RuntimeException e) {
            log.error("StoreWatch monitor failed to start: {}", e.getMessage(), e);
            shutdownHandler.disarm();
            context.close();
            System.exit(1);
        }
    }
}
