package com.libragraph.stageflow.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.stageflow.core.queue.QueueException;
import com.libragraph.stageflow.core.worker.StageWorker;
import com.libragraph.stageflow.core.worker.TriggerResult;
import jakarta.inject.Inject;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * HTTP trigger for stage workers: 202 when a batch was leased, 204 when the queue is empty.
 * The body is optional; without one the worker's configured batch size applies.
 */
@Path("/workers")
@Produces(MediaType.APPLICATION_JSON)
public class WorkerResource {

    private static final Logger log = Logger.getLogger(WorkerResource.class);

    @Inject
    StageWorker stageWorker;

    public record TriggerRequest(@JsonProperty("batchSize") Integer batchSize) {}

    @POST
    @Path("/{worker}")
    public Response trigger(@PathParam("worker") String worker, TriggerRequest request) {
        TriggerResult result;
        try {
            result = stageWorker.trigger(worker, request != null ? request.batchSize() : null);
        } catch (QueueException e) {
            log.errorf(e, "Worker %s could not read its queue", worker);
            return Response.serverError()
                    .entity(Map.of("error", "queue_pop_failed", "message", String.valueOf(e.getMessage())))
                    .build();
        }
        if (result.status() == TriggerResult.Status.EMPTY) {
            return Response.noContent().build();
        }
        return Response.accepted(Map.of(
                "message", "Processing " + result.count() + " messages",
                "count", result.count()
        )).build();
    }
}
