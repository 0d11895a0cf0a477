package com.eios.collab.websocket;

import com.eios.collab.session.ClientChannel;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import org.jboss.logging.Logger;

/**
 * {@link ClientChannel} over a websockets-next connection. Sends are fire-and-forget;
 * a failed send is logged and the close handler cleans up.
 */
class WebSocketChannel implements ClientChannel {

    private static final Logger LOG = Logger.getLogger(WebSocketChannel.class);

    private final WebSocketConnection connection;

    WebSocketChannel(WebSocketConnection connection) {
        this.connection = connection;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public void send(String json) {
        if (!connection.isOpen()) {
            return;
        }
        connection.sendText(json).subscribe().with(
            ignored -> { },
            failure -> LOG.debugf("Send to %s failed: %s", connection.id(), failure.getMessage()));
    }

    @Override
    public void close(int code, String reason) {
        if (!connection.isOpen()) {
            return;
        }
        connection.close(new CloseReason(code, reason)).subscribe().with(
            ignored -> { },
            failure -> LOG.debugf("Closing %s failed: %s", connection.id(), failure.getMessage()));
    }
}
