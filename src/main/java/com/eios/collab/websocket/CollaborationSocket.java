package com.eios.collab.websocket;

import com.eios.collab.message.*;
import com.eios.collab.room.DocumentKey;
import com.eios.collab.session.ConnectRequest;
import com.eios.collab.session.SessionManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.quarkus.websockets.next.*;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;

/**
 * WebSocket endpoint for real-time collaboration on one version of one site.
 * The bearer token comes from the Authorization header, or the {@code token} query
 * parameter for browsers that cannot set headers on a WebSocket.
 */
@WebSocket(path = "/ws/{siteId}/{version}")
public class CollaborationSocket {

    private static final Logger LOG = Logger.getLogger(CollaborationSocket.class);

    private static final String BEARER_PREFIX = "Bearer ";
    private static final int INVALID_DOCUMENT_CLOSE_CODE = 4400;

    @Inject
    SessionManager sessionManager;

    @Inject
    ObjectMapper mapper;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        HandshakeRequest handshake = connection.handshakeRequest();
        ConnectRequest request;
        try {
            request = connectRequest(connection.pathParam("siteId"), connection.pathParam("version"),
                handshake.header("Authorization"), handshake.query(), handshake.header("X-Forwarded-For"));
        } catch (IllegalArgumentException e) {
            LOG.warnf("Refusing connection %s: %s", connection.id(), e.getMessage());
            new WebSocketChannel(connection).close(INVALID_DOCUMENT_CLOSE_CODE, e.getMessage());
            return;
        }
        LOG.debugf("WebSocket opened: %s for %s", connection.id(), request.document());
        sessionManager.open(new WebSocketChannel(connection), request);
    }

    @OnTextMessage
    public void onMessage(String messageJson, WebSocketConnection connection) {
        WebSocketChannel channel = new WebSocketChannel(connection);
        ClientMessage msg;
        try {
            msg = mapper.readValue(messageJson, ClientMessage.class);
        } catch (JsonProcessingException e) {
            sendError(channel, ErrorCode.BAD_REQUEST, "Malformed frame: " + e.getOriginalMessage());
            return;
        }
        sessionManager.handle(channel, msg);
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        LOG.debugf("WebSocket closed: %s", connection.id());
        sessionManager.disconnect(new WebSocketChannel(connection));
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        LOG.warnf("WebSocket error on %s: %s", connection.id(), t.getMessage());
        sessionManager.disconnect(new WebSocketChannel(connection));
    }

    private void sendError(WebSocketChannel channel, ErrorCode code, String message) {
        try {
            channel.send(mapper.writeValueAsString(ServerMessage.error(code, message)));
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Failed to encode error frame for %s", channel.id());
        }
    }

    /**
     * Reads the handshake into a {@link ConnectRequest}.
     *
     * @throws IllegalArgumentException if the path does not name a valid document
     */
    static ConnectRequest connectRequest(String siteId, String version, String authorization, String query,
                                         String forwardedFor) {
        DocumentKey document = new DocumentKey(siteId, version);
        Map<String, List<String>> params = new QueryStringDecoder(query == null ? "" : query, false).parameters();

        String bearer = null;
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            bearer = authorization.substring(BEARER_PREFIX.length()).trim();
        } else if (param(params, "token") != null) {
            bearer = param(params, "token");
        }

        Long watermark = null;
        String rawWatermark = param(params, "watermark");
        if (rawWatermark != null) {
            try {
                watermark = Long.parseLong(rawWatermark);
            } catch (NumberFormatException e) {
                LOG.debugf("Ignoring malformed watermark '%s'", rawWatermark);
            }
        }

        String clientAddress = "unknown";
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            clientAddress = forwardedFor.split(",")[0].trim();
        }
        return new ConnectRequest(bearer, document, param(params, "name"), param(params, "color"), watermark,
            clientAddress);
    }

    private static String param(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
