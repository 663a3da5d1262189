package com.storewatch.monitor;

import io.micronaut.context.ApplicationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntConsumer;

/**
 * Turns a termination signal into a clean stop with exit status 0.
 *
 * The hook closes the application context (schedules, HTTP clients, S3 client and
 * connection pool) and then ends the JVM with status 0 instead of the signal's
 * 128+n.  A failed close ends with status 1.  On the startup-failure path the handler
 * is disarmed so that the explicit exit status is kept.
 */
final class ShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(ShutdownHandler.class);

    private final ApplicationContext context;
    private final IntConsumer halt;
    private volatile boolean armed = true;

    ShutdownHandler(ApplicationContext context, IntConsumer halt) {
        this.context = context;
        this.halt = halt;
    }

    static ShutdownHandler install(ApplicationContext context) {
        Runtime runtime = Runtime.getRuntime();
        ShutdownHandler handler = new ShutdownHandler(context, runtime::halt);
        runtime.addShutdownHook(new Thread(handler::onTermination, "storewatch-shutdown"));
        return handler;
    }

    void disarm() {
        armed = false;
    }

    void onTermination() {
        if (!armed) {
            return;
        }
        log.info("Termination requested, stopping StoreWatch monitor");
        try {
            if (context.isRunning()) {
                context.close();
            }
        } catch (RuntimeException e) {
            log.error("StoreWatch monitor did not stop cleanly: {}", e.getMessage(), e);
            halt.accept(1);
            return;
        }
        log.info("StoreWatch monitor stopped");
        halt.accept(0);
    }
}
