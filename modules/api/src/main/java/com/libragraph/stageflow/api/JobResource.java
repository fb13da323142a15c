package com.libragraph.stageflow.api;

import com.libragraph.stageflow.core.intake.IntakeRequest;
import com.libragraph.stageflow.core.intake.IntakeResult;
import com.libragraph.stageflow.core.intake.IntakeService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/jobs")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class JobResource {

    @Inject
    IntakeService intakeService;

    @POST
    @Path("/{pipeline}")
    public Response submit(@PathParam("pipeline") String pipeline, IntakeRequest request) {
        IntakeResult result = intakeService.submit(pipeline, request);
        return Response.accepted(result).build();
    }
}
