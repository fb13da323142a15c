package com.libragraph.stageflow.core.worker;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs work that outlives the request that started it.
 *
 * <p>Every submitted task is tracked by name until it finishes; failures are logged.
 * At shutdown the supervisor waits for a grace period and then names the tasks
 * still running, so interrupted batches can be matched to their redelivery.
 */
@ApplicationScoped
public class BackgroundTaskSupervisor {

    private static final Logger log = Logger.getLogger(BackgroundTaskSupervisor.class);

    @ConfigProperty(name = "stageflow.background.threads", defaultValue = "8")
    int threads;

    @ConfigProperty(name = "stageflow.background.shutdown-grace-seconds", defaultValue = "30")
    int graceSeconds;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private volatile ExecutorService executor;

    public BackgroundTaskSupervisor() {
    }

    public BackgroundTaskSupervisor(int threads, int graceSeconds) {
        this.threads = threads;
        this.graceSeconds = graceSeconds;
    }

    /**
     * Submits {@code task} under {@code name}.
     *
     * @throws RejectedExecutionException when the supervisor is shutting down
     */
    public void submit(String name, Runnable task) {
        executor().execute(() -> {
            inFlight.add(name);
            try {
                task.run();
            } catch (Exception e) {
                log.errorf(e, "Background task %s failed", name);
            } finally {
                inFlight.remove(name);
            }
        });
    }

    public Set<String> inFlight() {
        return Set.copyOf(inFlight);
    }

    @PreDestroy
    void shutdown() {
        ExecutorService ex = executor;
        if (ex == null) return;
        ex.shutdown();
        try {
            if (!ex.awaitTermination(graceSeconds, TimeUnit.SECONDS)) {
                log.warnf("Shutdown with %d background tasks still running: %s", inFlight.size(), inFlight);
                ex.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warnf("Interrupted during shutdown; in-flight tasks: %s", inFlight);
            ex.shutdownNow();
        }
    }

    private ExecutorService executor() {
        ExecutorService ex = executor;
        if (ex == null) {
            synchronized (this) {
                ex = executor;
                if (ex == null) {
                    ex = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                            new LinkedBlockingQueue<>(), ExecutorProducer.named("background"));
                    executor = ex;
                }
            }
        }
        return ex;
    }
}
