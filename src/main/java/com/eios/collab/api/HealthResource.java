package com.eios.collab.api;

import com.eios.collab.api.dto.HealthResponse;
import com.eios.collab.cluster.InstanceIdentity;
import com.eios.collab.cluster.RoomCoordinator;
import com.eios.collab.config.CollabConfig;
import com.eios.collab.persistence.PersistenceService;
import com.eios.collab.room.RoomStats;
import com.eios.collab.session.SessionManager;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Blocking
public class HealthResource {

    private static final Logger LOG = Logger.getLogger(HealthResource.class);

    @Inject SessionManager sessions;
    @Inject PersistenceService persistence;
    @Inject RoomCoordinator coordinator;
    @Inject InstanceIdentity instance;
    @Inject CollabConfig config;

    @GET
    @Path("/health")
    public HealthResponse health() {
        List<RoomStats> rooms = sessions.allStats();
        return new HealthResponse("ok", instance.id(), rooms.size(), sessions.sessionCount(), Map.of());
    }

    /**
     * 503 while storage or the cluster is unreachable, or while any room is read-only.
     */
    @GET
    @Path("/ready")
    public Response ready() {
        Map<String, String> checks = new LinkedHashMap<>();
        boolean ready = true;
        try {
            persistence.ping();
            checks.put("storage", "up");
        } catch (RuntimeException e) {
            LOG.warnf("Readiness: storage unreachable: %s", e.getMessage());
            checks.put("storage", "down");
            ready = false;
        }
        try {
            coordinator.ping().await().atMost(config.fanout().timeout());
            checks.put("cluster", "up");
        } catch (RuntimeException e) {
            LOG.warnf("Readiness: cluster unreachable: %s", e.getMessage());
            checks.put("cluster", "down");
            ready = false;
        }
        List<RoomStats> rooms = sessions.allStats();
        long degraded = rooms.stream().filter(RoomStats::degraded).count();
        checks.put("degradedRooms", Long.toString(degraded));
        if (degraded > 0) {
            ready = false;
        }
        HealthResponse body = new HealthResponse(ready ? "ready" : "unavailable", instance.id(), rooms.size(),
            sessions.sessionCount(), checks);
        return Response.status(ready ? 200 : 503).entity(body).build();
    }
}
