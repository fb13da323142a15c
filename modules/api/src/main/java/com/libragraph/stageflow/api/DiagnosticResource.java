package com.libragraph.stageflow.api;

import com.libragraph.stageflow.core.stage.StageBinding;
import com.libragraph.stageflow.core.stage.StageRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @Inject
    StageRegistry registry;

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "stageflow.store.type", defaultValue = "postgres")
    String storeType;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", appName + " is running",
                "store", storeType
        );
    }

    /** Registered workers with their resolved queue settings. */
    @GET
    @Path("/workers")
    public List<Map<String, Object>> workers() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (StageBinding b : registry.workers()) {
            Map<String, Object> w = new LinkedHashMap<>();
            w.put("worker", b.workerName());
            w.put("queue", b.queue());
            w.put("stage", b.stage());
            w.put("handler", b.handler().getClass().getSimpleName());
            w.put("jobs_per_worker", b.jobsPerWorker());
            w.put("visibility_seconds", b.settings().visibility().getSeconds());
            w.put("batch_size", b.settings().batchSize());
            w.put("max_attempts", b.settings().maxAttempts());
            w.put("retry_delay_seconds", b.settings().retryDelay().getSeconds());
            result.add(w);
        }
        return result;
    }
}
