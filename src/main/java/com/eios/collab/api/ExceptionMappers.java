package com.eios.collab.api;

import com.eios.collab.error.RoomNotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

public class ExceptionMappers {

    public static class ErrorBody {
        public String error;

        public ErrorBody(String error) {
            this.error = error;
        }
    }

    @Provider
    public static class RoomNotFoundMapper implements ExceptionMapper<RoomNotFoundException> {
        @Override
        public Response toResponse(RoomNotFoundException e) {
            return Response.status(404).type(MediaType.APPLICATION_JSON).entity(new ErrorBody(e.getMessage())).build();
        }
    }

    @Provider
    public static class BadRoomIdMapper implements ExceptionMapper<IllegalArgumentException> {
        @Override
        public Response toResponse(IllegalArgumentException e) {
            String msg = e.getMessage();
            if (msg == null || msg.isBlank()) msg = "bad_request";
            return Response.status(400).type(MediaType.APPLICATION_JSON).entity(new ErrorBody(msg)).build();
        }
    }
}
