package com.eios.collab.testing;

import com.eios.collab.session.ClientChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Client channel that records what the server sent and how it closed.
 */
public class RecordingChannel implements ClientChannel {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile Integer closeCode;
    private volatile String closeReason;

    public RecordingChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String json) {
        sent.add(json);
    }

    @Override
    public void close(int code, String reason) {
        if (closeCode == null) {
            closeCode = code;
            closeReason = reason;
        }
    }

    public List<JsonNode> frames() {
        return sent.stream().map(RecordingChannel::parse).toList();
    }

    public List<JsonNode> frames(String type) {
        return frames().stream().filter(f -> type.equals(f.path("type").asText())).toList();
    }

    public JsonNode last(String type) {
        List<JsonNode> matching = frames(type);
        if (matching.isEmpty()) {
            throw new AssertionError("No '" + type + "' frame sent to " + id + ", got " + sent);
        }
        return matching.get(matching.size() - 1);
    }

    public void clear() {
        sent.clear();
    }

    public boolean isClosed() {
        return closeCode != null;
    }

    public Integer closeCode() {
        return closeCode;
    }

    public String closeReason() {
        return closeReason;
    }

    private static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
