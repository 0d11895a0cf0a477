package com.eios.collab.cluster;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.MultiEmitter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process bus. Every engine wired to the same instance behaves like a separate
 * process on a shared channel.
 */
public class LocalFanoutBus implements FanoutBus {

    private final Map<String, List<MultiEmitter<? super BusMessage>>> subscribers = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> publish(String roomId, BusMessage message) {
        return Uni.createFrom().item(() -> {
            subscribers.getOrDefault(roomId, List.of()).forEach(emitter -> emitter.emit(message));
            return null;
        });
    }

    @Override
    public Multi<BusMessage> subscribe(String roomId) {
        return Multi.createFrom().emitter(emitter -> {
            List<MultiEmitter<? super BusMessage>> list =
                subscribers.computeIfAbsent(roomId, k -> new CopyOnWriteArrayList<>());
            list.add(emitter);
            emitter.onTermination(() -> list.remove(emitter));
        });
    }

    int subscriberCount(String roomId) {
        return subscribers.getOrDefault(roomId, List.of()).size();
    }
}
