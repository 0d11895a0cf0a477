package com.eios.collab.error;

/**
 * The room is not loaded on this process.
 */
public class RoomNotFoundException extends CollabException {

    public RoomNotFoundException(String roomId) {
        super("Room " + roomId + " is not loaded on this instance");
    }
}
