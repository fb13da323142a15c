package com.libragraph.stageflow.core.worker;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.UUID;

/**
 * Identity written to {@code locked_by} when this process leases a job.
 * Defaults to {@code <hostname>:<pid>-<suffix>}, where the six-character hex suffix is random per
 * process start so a recycled pid on the same host never reuses an old identity.
 */
@ApplicationScoped
public class WorkerIdentity {

    private static final Logger log = Logger.getLogger(WorkerIdentity.class);

    @ConfigProperty(name = "stageflow.worker.id")
    Optional<String> configuredId;

    private String id;

    public WorkerIdentity() {
    }

    public WorkerIdentity(String id) {
        this.id = id;
    }

    @PostConstruct
    void init() {
        id = configuredId.filter(s -> !s.isBlank()).orElseGet(WorkerIdentity::defaultId);
        log.infof("Worker identity: %s", id);
    }

    public String id() {
        return id;
    }

    static String defaultId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        String suffix = UUID.randomUUID().toString().substring(0, 6);
        return host + ":" + ProcessHandle.current().pid() + "-" + suffix;
    }
}
