package com.libragraph.stageflow.core.worker;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = "stageflow.runner.threads", defaultValue = "16")
    int runnerThreads;

    @ConfigProperty(name = "stageflow.heartbeat.threads", defaultValue = "2")
    int heartbeatThreads;

    private final List<ExecutorService> executors = new ArrayList<>();

    @Produces
    @ApplicationScoped
    @Named("stageExecutor")
    public ExecutorService stageExecutor() {
        return track(Executors.newFixedThreadPool(runnerThreads, named("stage-runner")));
    }

    @Produces
    @ApplicationScoped
    @Named("heartbeatExecutor")
    public ScheduledExecutorService heartbeatExecutor() {
        return track(Executors.newScheduledThreadPool(heartbeatThreads, named("stage-heartbeat")));
    }

    @PreDestroy
    void shutdown() {
        synchronized (executors) {
            executors.forEach(ExecutorService::shutdown);
        }
    }

    private <E extends ExecutorService> E track(E executor) {
        synchronized (executors) {
            executors.add(executor);
        }
        return executor;
    }

    static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
