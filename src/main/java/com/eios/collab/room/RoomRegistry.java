package com.eios.collab.room;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rooms served by this process. A room is created on first join and removed once it
 * has been empty for the grace period and its state is durable.
 *
 * <p>Creating a room is cheap; loading its document happens afterwards under the
 * room's own lock so that a slow restore never holds up other rooms.
 */
@ApplicationScoped
public class RoomRegistry {

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final ObjectMapper mapper;
    private final Clock clock;

    @Inject
    public RoomRegistry(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    public Room getOrCreate(DocumentKey key) {
        return rooms.computeIfAbsent(key.roomId(), id -> new Room(key, mapper, clock.instant()));
    }

    public Optional<Room> get(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * Removes the room only if it is still the registered instance.
     */
    public boolean remove(Room room) {
        return rooms.remove(room.id(), room);
    }

    public Collection<Room> rooms() {
        return List.copyOf(rooms.values());
    }

    public int size() {
        return rooms.size();
    }

    /**
     * Whether the room has had no members for at least {@code grace}.
     */
    public static boolean isEvictable(Room room, Instant now, Duration grace) {
        Instant emptySince = room.emptySince();
        return room.isEmpty() && emptySince != null && !emptySince.plus(grace).isAfter(now);
    }
}
