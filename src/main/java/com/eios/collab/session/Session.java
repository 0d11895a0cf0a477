package com.eios.collab.session;

import com.eios.collab.security.Identity;

import java.time.Instant;

/**
 * One connected client in one room. The session id doubles as the origin of the
 * stamps the client puts on its operations.
 */
public class Session {

    private final String id;
    private final ClientChannel channel;
    private final String roomId;
    private final Instant connectedAt;

    private volatile SessionState state = SessionState.CONNECTING;
    private volatile Identity identity;
    private volatile String name;
    private volatile String color;
    private volatile Instant lastSeen;
    private volatile long acknowledged;

    public Session(String id, ClientChannel channel, String roomId, Instant connectedAt) {
        this.id = id;
        this.channel = channel;
        this.roomId = roomId;
        this.connectedAt = connectedAt;
        this.lastSeen = connectedAt;
    }

    public String id() {
        return id;
    }

    public ClientChannel channel() {
        return channel;
    }

    public String roomId() {
        return roomId;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public SessionState state() {
        return state;
    }

    /**
     * @throws IllegalStateException if the lifecycle does not allow moving to {@code next}
     */
    synchronized void transition(SessionState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Session " + id + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    /**
     * Moves to {@code next} only if the session is currently in {@code expected}.
     */
    synchronized boolean transition(SessionState expected, SessionState next) {
        if (state != expected) {
            return false;
        }
        transition(next);
        return true;
    }

    /**
     * Starts leaving a joined session.
     *
     * @return {@code false} if the session is not joined or is already leaving
     */
    synchronized boolean beginDisconnect() {
        if (!isOpen()) {
            return false;
        }
        state = SessionState.DISCONNECTING;
        return true;
    }

    public Identity identity() {
        return identity;
    }

    void authenticated(Identity identity, String name, String color) {
        this.identity = identity;
        this.name = name;
        this.color = color;
    }

    public String userId() {
        return identity == null ? null : identity.userId();
    }

    public boolean canEdit() {
        return identity != null && identity.canEdit();
    }

    public String name() {
        return name;
    }

    public String color() {
        return color;
    }

    public Instant lastSeen() {
        return lastSeen;
    }

    void touch(Instant now) {
        lastSeen = now;
    }

    public long acknowledged() {
        return acknowledged;
    }

    void acknowledge(long watermark) {
        if (watermark > acknowledged) {
            acknowledged = watermark;
        }
    }

    public boolean isOpen() {
        SessionState s = state;
        return s == SessionState.JOINED || s == SessionState.ACTIVE;
    }
}
