package com.hello.chatrealtime.service;

import com.hello.chatrealtime.dto.PresenceUpdate;
import com.hello.chatrealtime.model.PresenceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Presence is global: every connected client sees every online/offline
 * transition, whatever rooms it has joined.
 */
@Service
public class PresencePublisher {

    public static final String USER_PRESENCE = "user_presence";

    private static final Logger logger = LoggerFactory.getLogger(PresencePublisher.class);

    private final EventBroadcaster broadcaster;

    public PresencePublisher(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    public void publish(String userId, PresenceStatus status, Instant timestamp) {
        logger.debug("Publishing presence {} for user {}", status.getWireName(), userId);
        broadcaster.broadcast(USER_PRESENCE, PresenceUpdate.builder()
                .userId(userId)
                .status(status)
                .lastActive(timestamp)
                .build());
    }
}
