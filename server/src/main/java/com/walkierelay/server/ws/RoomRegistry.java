package com.walkierelay.server.ws;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Transport-level broadcast groups: room id to the connection ids bound to it.
 */
@Component
public class RoomRegistry {

    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();

    public void add(String roomId, String connectionId) {
        rooms.computeIfAbsent(roomId, k -> new CopyOnWriteArraySet<>()).add(connectionId);
    }

    public void remove(String roomId, String connectionId) {
        rooms.computeIfPresent(roomId, (k, set) -> {
            set.remove(connectionId);
            return set.isEmpty() ? null : set;
        });
    }

    public void removeEverywhere(String connectionId) {
        for (String roomId : rooms.keySet()) {
            remove(roomId, connectionId);
        }
    }

    public Set<String> get(String roomId) {
        return rooms.getOrDefault(roomId, Set.of());
    }
}
