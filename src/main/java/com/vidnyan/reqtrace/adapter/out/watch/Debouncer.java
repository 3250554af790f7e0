package com.vidnyan.reqtrace.adapter.out.watch;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs an action once a burst of triggers has been quiet for the configured delay.
 */
public class Debouncer implements AutoCloseable {

    private final ScheduledExecutorService scheduler;
    private final Duration delay;
    private final Runnable action;
    private ScheduledFuture<?> scheduled;

    public Debouncer(Duration delay, Runnable action) {
        this.delay = delay;
        this.action = action;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "reqtrace-debounce");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void trigger() {
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        scheduled = scheduler.schedule(action, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
