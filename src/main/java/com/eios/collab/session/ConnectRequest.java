package com.eios.collab.session;

import com.eios.collab.room.DocumentKey;

/**
 * What a client presents when it connects.
 *
 * @param watermark last sequence the client acknowledged before a reconnect, or
 *                  {@code null} for a fresh join
 */
public record ConnectRequest(
    String bearer,
    DocumentKey document,
    String name,
    String color,
    Long watermark,
    String clientAddress
) {}
