package com.eios.collab.client;

import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * Stored scene graphs of the platform API, used to seed rooms that have no history.
 */
@RegisterRestClient(configKey = "platform-api")
@Path("/api/sites")
@Produces(MediaType.APPLICATION_JSON)
public interface DocumentClient {

    @GET
    @Path("/{siteId}/versions/{version}/scene-graph")
    SceneGraphResponse getSceneGraph(@PathParam("siteId") String siteId, @PathParam("version") String version);
}
