package com.libragraph.stageflow.core.worker;

import com.libragraph.stageflow.core.stage.StageOutcome;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Launches workers in-process on a bounded pool. Launches beyond the pool's
 * queue capacity are rejected rather than buffered.
 */
@ApplicationScoped
public class PooledWorkerLauncher implements WorkerLauncher {

    private static final Logger log = Logger.getLogger(PooledWorkerLauncher.class);

    @Inject
    StageWorker stageWorker;

    @ConfigProperty(name = "stageflow.launcher.threads", defaultValue = "8")
    int threads;

    @ConfigProperty(name = "stageflow.launcher.queue-capacity", defaultValue = "32")
    int queueCapacity;

    private ThreadPoolExecutor pool;

    @PostConstruct
    void init() {
        pool = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity), ExecutorProducer.named("worker-launch"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public boolean launch(String workerName) {
        try {
            pool.execute(() -> {
                try {
                    List<StageOutcome> outcomes = stageWorker.runOnce(workerName);
                    log.debugf("Launched worker %s processed %d messages", workerName, outcomes.size());
                } catch (Exception e) {
                    log.errorf(e, "Launched worker %s failed", workerName);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.warnf("Launch of %s rejected: pool saturated (%d active, %d queued)",
                    workerName, pool.getActiveCount(), pool.getQueue().size());
            return false;
        }
    }

    @PreDestroy
    void shutdown() {
        if (pool != null) pool.shutdown();
    }
}
