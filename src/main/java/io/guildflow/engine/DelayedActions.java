package io.guildflow.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public final class DelayedActions implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DelayedActions.class);

    private final ScheduledExecutorService scheduler;

    public DelayedActions() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "guildflow-delayed");
            t.setDaemon(true);
            return t;
        });
    }

    public ScheduledFuture<?> schedule(String description, Duration delay, Runnable action) {
        long delayMs = Math.max(0L, delay.toMillis());
        return scheduler.schedule(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.warn("Delayed action failed, not retried: {}: {}", description, e.getMessage(), e);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        int dropped = scheduler.shutdownNow().size();
        if (dropped > 0) {
            log.info("Dropped {} pending delayed actions on shutdown", dropped);
        }
    }
}
