package com.libragraph.stageflow.api;

import com.libragraph.stageflow.core.health.AlertNotifier;
import com.libragraph.stageflow.core.health.HealthMonitor;
import com.libragraph.stageflow.core.health.HealthReport;
import com.libragraph.stageflow.core.health.HealthThresholds;
import com.libragraph.stageflow.core.intake.ValidationException;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Pipeline health. Responds 503 when any critical alert is active.
 */
@Path("/healthcheck")
@Produces(MediaType.APPLICATION_JSON)
public class HealthcheckResource {

    @Inject
    HealthMonitor monitor;

    @Inject
    AlertNotifier notifier;

    @GET
    public Response get(@QueryParam("duration_threshold_ms") Long durationMs,
                        @QueryParam("error_rate_threshold") Double errorRate,
                        @QueryParam("queue_depth_threshold") Long queueDepth,
                        @QueryParam("send_alert") boolean sendAlert) {
        return check(durationMs, errorRate, queueDepth, sendAlert);
    }

    @POST
    public Response post(@QueryParam("duration_threshold_ms") Long durationMs,
                         @QueryParam("error_rate_threshold") Double errorRate,
                         @QueryParam("queue_depth_threshold") Long queueDepth,
                         @QueryParam("send_alert") boolean sendAlert) {
        return check(durationMs, errorRate, queueDepth, sendAlert);
    }

    Response check(Long durationMs, Double errorRate, Long queueDepth, boolean sendAlert) {
        HealthThresholds thresholds;
        try {
            thresholds = HealthThresholds.of(durationMs, errorRate, queueDepth);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        HealthReport report = monitor.evaluate(thresholds);
        if (sendAlert) {
            notifier.notify(report);
        }
        return Response.status(report.httpStatus()).entity(report).build();
    }
}
