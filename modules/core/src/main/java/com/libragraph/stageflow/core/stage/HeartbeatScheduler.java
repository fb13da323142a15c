package com.libragraph.stageflow.core.stage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs periodic heartbeats for in-flight stage handlers.
 */
@ApplicationScoped
public class HeartbeatScheduler {

    private static final Logger log = Logger.getLogger(HeartbeatScheduler.class);

    @Inject
    @Named("heartbeatExecutor")
    ScheduledExecutorService executor;

    public HeartbeatScheduler() {
    }

    public HeartbeatScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Invokes {@code beat} every {@code interval} until the returned handle is closed.
     * A failing beat is logged and retried on the next tick.
     */
    public Heartbeat start(String description, Duration interval, Runnable beat) {
        long millis = Math.max(interval.toMillis(), 100);
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> {
            try {
                beat.run();
            } catch (Exception e) {
                log.warnf("Heartbeat for %s failed: %s", description, e.getMessage());
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @FunctionalInterface
    public interface Heartbeat extends AutoCloseable {
        @Override
        void close();
    }
}
