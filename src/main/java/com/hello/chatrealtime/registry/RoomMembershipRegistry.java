package com.hello.chatrealtime.registry;

import com.hello.chatrealtime.model.RoomKey;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-memory live sets: which users currently receive a room's real-time events.
 * Persisted membership is not tracked here. Both indexes are guarded by one lock
 * and no method does I/O while holding it.
 */
@Component
public class RoomMembershipRegistry {

    private final Object lock = new Object();

    // room -> users subscribed to its live events
    private final Map<RoomKey, Set<String>> members = new HashMap<>();

    // user -> rooms, so disconnect does not scan every room
    private final Map<String, Set<RoomKey>> roomsByUser = new HashMap<>();

    /**
     * @return true if the user was not already in the live set
     */
    public boolean add(RoomKey room, String userId) {
        synchronized (lock) {
            boolean added = members.computeIfAbsent(room, k -> new HashSet<>()).add(userId);
            if (added) {
                roomsByUser.computeIfAbsent(userId, k -> new HashSet<>()).add(room);
            }
            return added;
        }
    }

    /**
     * @return true if the user was in the live set
     */
    public boolean remove(RoomKey room, String userId) {
        synchronized (lock) {
            Set<String> users = members.get(room);
            if (users == null || !users.remove(userId)) {
                return false;
            }
            if (users.isEmpty()) {
                members.remove(room);
            }
            Set<RoomKey> rooms = roomsByUser.get(userId);
            if (rooms != null) {
                rooms.remove(room);
                if (rooms.isEmpty()) {
                    roomsByUser.remove(userId);
                }
            }
            return true;
        }
    }

    /**
     * Removes the user from every live set at once.
     *
     * @return the rooms the user was removed from; empty if the user was in none
     */
    public Set<RoomKey> removeAll(String userId) {
        synchronized (lock) {
            Set<RoomKey> rooms = roomsByUser.remove(userId);
            if (rooms == null) {
                return Collections.emptySet();
            }
            for (RoomKey room : rooms) {
                Set<String> users = members.get(room);
                if (users != null) {
                    users.remove(userId);
                    if (users.isEmpty()) {
                        members.remove(room);
                    }
                }
            }
            return Set.copyOf(rooms);
        }
    }

    public boolean contains(RoomKey room, String userId) {
        synchronized (lock) {
            Set<String> users = members.get(room);
            return users != null && users.contains(userId);
        }
    }

    public Set<String> getMembers(RoomKey room) {
        synchronized (lock) {
            Set<String> users = members.get(room);
            return users == null ? Collections.emptySet() : Set.copyOf(users);
        }
    }

    public Set<RoomKey> getRooms(String userId) {
        synchronized (lock) {
            Set<RoomKey> rooms = roomsByUser.get(userId);
            return rooms == null ? Collections.emptySet() : Set.copyOf(rooms);
        }
    }
}
