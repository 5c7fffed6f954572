package com.hello.chatrealtime.service;

import com.hello.chatrealtime.dto.RoomEvent;
import com.hello.chatrealtime.exception.NotAMemberException;
import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.persistence.ChatPersistenceGateway;
import com.hello.chatrealtime.registry.ConnectionRegistry;
import com.hello.chatrealtime.registry.RoomMembershipRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Join and leave for room live sets. Joining is gated by persisted membership;
 * leaving never fails.
 */
@Service
public class RoomMembershipService {

    public static final String USER_JOINED = "user_joined";
    public static final String USER_LEFT = "user_left";

    private static final Logger logger = LoggerFactory.getLogger(RoomMembershipService.class);

    public enum JoinResult {
        JOINED,
        ALREADY_JOINED,
        DISCONNECTED
    }

    private final RoomMembershipRegistry registry;
    private final ConnectionRegistry connectionRegistry;
    private final ChatPersistenceGateway persistenceGateway;
    private final EventBroadcaster broadcaster;

    public RoomMembershipService(RoomMembershipRegistry registry,
            ConnectionRegistry connectionRegistry,
            ChatPersistenceGateway persistenceGateway,
            EventBroadcaster broadcaster) {
        this.registry = registry;
        this.connectionRegistry = connectionRegistry;
        this.persistenceGateway = persistenceGateway;
        this.broadcaster = broadcaster;
    }

    /**
     * Adds the user to the room's live set and confirms to the joining user.
     * Existing members hear about the join only the first time; re-joining leaves
     * the set unchanged. A user whose connection was torn down while the join was
     * in flight is taken back out and nobody is told.
     *
     * @throws NotAMemberException if the user has no persisted membership in the room
     */
    public JoinResult join(String userId, RoomKey room) {
        // membership lookup happens before touching the live set
        if (!persistenceGateway.isMember(userId, room)) {
            throw new NotAMemberException(room);
        }

        boolean added = registry.add(room, userId);
        // teardown may have run leaveAll between the membership lookup and the add
        if (!connectionRegistry.isOnline(userId)) {
            if (added) {
                registry.remove(room, userId);
            }
            logger.debug("Dropped join of {} to {}: user disconnected", userId, room);
            return JoinResult.DISCONNECTED;
        }
        broadcaster.sendToUser(userId, room.type().getJoinedEvent(), RoomEvent.in(room).build());
        if (!added) {
            return JoinResult.ALREADY_JOINED;
        }

        logger.debug("User {} joined {}", userId, room);
        broadcaster.sendToRoom(room, USER_JOINED, RoomEvent.in(room).userId(userId).build(), userId);
        return JoinResult.JOINED;
    }

    public void leave(String userId, RoomKey room) {
        if (registry.remove(room, userId)) {
            logger.debug("User {} left {}", userId, room);
            notifyLeft(userId, room);
        }
    }

    /**
     * Removes the user from every live set, telling the remaining members of each.
     *
     * @return the rooms the user was removed from
     */
    public Set<RoomKey> leaveAll(String userId) {
        Set<RoomKey> rooms = registry.removeAll(userId);
        for (RoomKey room : rooms) {
            notifyLeft(userId, room);
        }
        return rooms;
    }

    public Set<String> listOnlineMembers(RoomKey room) {
        return registry.getMembers(room);
    }

    public boolean isInLiveSet(String userId, RoomKey room) {
        return registry.contains(room, userId);
    }

    private void notifyLeft(String userId, RoomKey room) {
        broadcaster.sendToRoom(room, USER_LEFT, RoomEvent.in(room).userId(userId).build(), userId);
    }
}
