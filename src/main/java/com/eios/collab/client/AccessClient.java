package com.eios.collab.client;

import jakarta.ws.rs.*;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * Authorization check of the platform API: may the bearer open this site version.
 * Answers 401 for a bad credential, 403 for no access and 404 for an unknown document.
 */
@RegisterRestClient(configKey = "platform-api")
@Path("/api/sites")
@Produces(MediaType.APPLICATION_JSON)
public interface AccessClient {

    @GET
    @Path("/{siteId}/versions/{version}/access")
    AccessResponse checkAccess(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                               @PathParam("siteId") String siteId,
                               @PathParam("version") String version);
}
