package com.hello.chatrealtime.service;

import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.registry.Connection;
import com.hello.chatrealtime.registry.ConnectionRegistry;
import com.hello.chatrealtime.registry.RoomMembershipRegistry;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

/**
 * Outbound fan-out. Every target is resolved through the connection registry at
 * send time, so an event for a user who has just disconnected is dropped and an
 * event for a user who has just reconnected goes to the new connection.
 */
@Service
public class EventBroadcaster {

    private final ConnectionRegistry connectionRegistry;
    private final RoomMembershipRegistry roomMembershipRegistry;

    public EventBroadcaster(ConnectionRegistry connectionRegistry, RoomMembershipRegistry roomMembershipRegistry) {
        this.connectionRegistry = connectionRegistry;
        this.roomMembershipRegistry = roomMembershipRegistry;
    }

    /**
     * @return true if the user had a live connection to send to
     */
    public boolean sendToUser(String userId, String event, Object payload) {
        Optional<Connection> connection = connectionRegistry.find(userId);
        connection.ifPresent(c -> c.send(event, payload));
        return connection.isPresent();
    }

    /**
     * @return number of users the event was handed to
     */
    public int sendToUsers(Collection<String> userIds, String event, Object payload) {
        int sent = 0;
        for (String userId : userIds) {
            if (sendToUser(userId, event, payload)) {
                sent++;
            }
        }
        return sent;
    }

    /**
     * Sends to every live member of the room except {@code excludedUserId}.
     *
     * @return number of members the event was handed to
     */
    public int sendToRoom(RoomKey room, String event, Object payload, String excludedUserId) {
        int sent = 0;
        for (String userId : roomMembershipRegistry.getMembers(room)) {
            if (!userId.equals(excludedUserId) && sendToUser(userId, event, payload)) {
                sent++;
            }
        }
        return sent;
    }

    public void broadcast(String event, Object payload) {
        for (Connection connection : connectionRegistry.getAllConnections()) {
            connection.send(event, payload);
        }
    }
}
