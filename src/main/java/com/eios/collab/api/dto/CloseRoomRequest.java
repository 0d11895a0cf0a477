package com.eios.collab.api.dto;

public class CloseRoomRequest {
    public String reason;
}
