package com.eios.collab.cluster;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

/**
 * Publish/subscribe medium shared by every process. Delivery is at-least-once and
 * subscribers may also receive their own publishes.
 */
public interface FanoutBus {

    Uni<Void> publish(String roomId, BusMessage message);

    /**
     * Messages published to the room from now on. Cancelling the subscription
     * unsubscribes from the channel.
     */
    Multi<BusMessage> subscribe(String roomId);
}
