package com.libragraph.stageflow.api;

import com.libragraph.stageflow.core.scale.Orchestrator;
import com.libragraph.stageflow.core.scale.OrchestratorRequest;
import com.libragraph.stageflow.core.scale.OrchestratorSummary;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Runs the autoscaler synchronously; the response arrives when the queues drain or the
 * requested duration elapses.
 */
@Path("/orchestrator")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class OrchestratorResource {

    @Inject
    Orchestrator orchestrator;

    @POST
    public OrchestratorSummary run(OrchestratorRequest request) {
        return orchestrator.run(request);
    }
}
