package com.eios.collab.api;

import com.eios.collab.api.dto.CloseRoomRequest;
import com.eios.collab.error.RoomNotFoundException;
import com.eios.collab.persistence.PersistenceService;
import com.eios.collab.persistence.SnapshotInfo;
import com.eios.collab.room.DocumentKey;
import com.eios.collab.room.RoomStats;
import com.eios.collab.session.SessionManager;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.Map;

/**
 * Operator view of the rooms served by this instance.
 */
@Path("/rooms")
@Produces(MediaType.APPLICATION_JSON)
@Blocking
public class RoomResource {

    private static final String DEFAULT_CLOSE_REASON = "Closed for maintenance";

    @Inject SessionManager sessions;
    @Inject PersistenceService persistence;

    @GET
    public List<RoomStats> rooms() {
        return sessions.allStats();
    }

    @GET
    @Path("/{roomId}/stats")
    public RoomStats stats(@PathParam("roomId") String roomId) {
        return sessions.stats(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    /**
     * Closes the room on every instance. Members receive {@code room_closing} and are
     * disconnected; the room is snapshotted and evicted.
     */
    @POST
    @Path("/{roomId}/close")
    @Consumes(MediaType.APPLICATION_JSON)
    public Map<String, Object> close(@PathParam("roomId") String roomId, CloseRoomRequest req) {
        String reason = req == null || req.reason == null || req.reason.isBlank() ? DEFAULT_CLOSE_REASON : req.reason;
        if (!sessions.closeRoom(roomId, reason)) {
            throw new RoomNotFoundException(roomId);
        }
        return Map.of("roomId", roomId, "closed", true);
    }

    /**
     * Every stored snapshot version of the document, oldest first, including the ones
     * compaction no longer loads.
     */
    @GET
    @Path("/{roomId}/snapshots")
    public List<SnapshotInfo> snapshots(@PathParam("roomId") String roomId) {
        return persistence.listSnapshots(DocumentKey.parse(roomId).roomId());
    }
}
