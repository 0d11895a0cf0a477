package com.eios.collab.session;

/**
 * Outbound side of one client connection. Sends never block the caller.
 */
public interface ClientChannel {

    String id();

    void send(String json);

    void close(int code, String reason);
}
