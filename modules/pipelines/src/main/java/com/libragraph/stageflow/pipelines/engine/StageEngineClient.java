package com.libragraph.stageflow.pipelines.engine;

import io.smallrye.faulttolerance.api.CircuitBreakerName;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.time.temporal.ChronoUnit;

/**
 * Remote service that performs the business work of a stage (crawling, model calls, publishing).
 * Base URL from {@code quarkus.rest-client.stage-engine.url}.
 *
 * <p><b>Circuit breaker:</b> opens after 5 consecutive failed calls and rejects calls for
 * 5 minutes with {@code CircuitBreakerOpenException}, which the runner treats as transient.
 * 3 successful trial calls close it again.
 */
@RegisterRestClient(configKey = "stage-engine")
@Path("/stages")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public interface StageEngineClient {

    @POST
    @Path("/{pipeline}/{stage}")
    @CircuitBreaker(
            requestVolumeThreshold = 5,
            failureRatio = 1.0,
            delay = 5,
            delayUnit = ChronoUnit.MINUTES,
            successThreshold = 3)
    @CircuitBreakerName("stage-engine")
    EngineResponse run(@PathParam("pipeline") String pipeline,
                       @PathParam("stage") String stage,
                       EngineRequest request);
}
