package com.libragraph.stageflow.api;

import com.libragraph.stageflow.core.rescue.RescueRequest;
import com.libragraph.stageflow.core.rescue.RescueResult;
import com.libragraph.stageflow.core.rescue.RescueService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/bulk-rescue")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class RescueResource {

    @Inject
    RescueService rescueService;

    @POST
    public RescueResult rescue(RescueRequest request) {
        return rescueService.rescue(request);
    }
}
