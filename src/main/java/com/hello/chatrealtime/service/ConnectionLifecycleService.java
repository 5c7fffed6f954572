package com.hello.chatrealtime.service;

import com.hello.chatrealtime.model.PresenceStatus;
import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.persistence.ChatPersistenceGateway;
import com.hello.chatrealtime.registry.Connection;
import com.hello.chatrealtime.registry.ConnectionHandle;
import com.hello.chatrealtime.registry.ConnectionRegistry;
import com.hello.chatrealtime.registry.ConnectionRegistry.Registration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;

/**
 * Session lifecycle of a persistent connection: authentication at handshake,
 * registration and presence on connect, and full teardown on disconnect.
 */
@Service
public class ConnectionLifecycleService {

    /** Close code sent to a connection replaced by a newer one for the same user. */
    public static final int CLOSE_REPLACED = 4001;

    private static final Logger logger = LoggerFactory.getLogger(ConnectionLifecycleService.class);

    private final AuthService authService;
    private final ConnectionRegistry connectionRegistry;
    private final RoomMembershipService roomMembershipService;
    private final CallSessionManager callSessionManager;
    private final PresencePublisher presencePublisher;
    private final MessageStatusService messageStatusService;
    private final ChatPersistenceGateway persistenceGateway;
    private final Clock clock;

    public ConnectionLifecycleService(AuthService authService,
            ConnectionRegistry connectionRegistry,
            RoomMembershipService roomMembershipService,
            CallSessionManager callSessionManager,
            PresencePublisher presencePublisher,
            MessageStatusService messageStatusService,
            ChatPersistenceGateway persistenceGateway,
            Clock clock) {
        this.authService = authService;
        this.connectionRegistry = connectionRegistry;
        this.roomMembershipService = roomMembershipService;
        this.callSessionManager = callSessionManager;
        this.presencePublisher = presencePublisher;
        this.messageStatusService = messageStatusService;
        this.persistenceGateway = persistenceGateway;
        this.clock = clock;
    }

    /**
     * @return the user id the token belongs to
     * @throws com.hello.chatrealtime.exception.AuthFailureException if the token is
     *         missing, invalid, expired, or names an unknown user
     */
    public String authenticate(String token) {
        return authService.authenticate(token);
    }

    /**
     * Registers the connection (replacing any previous one for the user), marks the
     * user online, announces it to everyone, and delivers messages that were
     * waiting for the user.
     */
    public Connection onConnect(String userId, ConnectionHandle handle) {
        Instant now = clock.instant();
        Registration registration = connectionRegistry.register(userId, handle, now);
        registration.replaced().ifPresent(previous ->
                previous.getHandle().close(CLOSE_REPLACED, "Replaced by a newer connection"));
        logger.info("User {} connected ({})", userId, handle.getId());

        try {
            persistenceGateway.setUserOnline(userId, true, now);
        } catch (RuntimeException e) {
            logger.error("Failed to store online state for user {}", userId, e);
        }

        presencePublisher.publish(userId, PresenceStatus.ONLINE, now);
        messageStatusService.deliverPendingMessages(userId);
        return registration.connection();
    }

    /**
     * Tears the user's session down: registry entry, room live sets, calls and
     * presence. Runs at most once per connection, and not at all for a connection
     * that has already been replaced by a newer one.
     */
    public void onDisconnect(Connection connection) {
        if (!connection.markClosed()) {
            return;
        }
        String userId = connection.getUserId();
        if (!connectionRegistry.unregister(connection)) {
            logger.debug("Closed replaced connection {} of user {}", connection.getHandle().getId(), userId);
            return;
        }

        Instant now = clock.instant();
        logger.info("User {} disconnected ({})", userId, connection.getHandle().getId());

        Set<RoomKey> rooms = roomMembershipService.leaveAll(userId);
        logger.debug("Removed user {} from {} rooms", userId, rooms.size());
        callSessionManager.endAllFor(userId);

        try {
            persistenceGateway.setUserOnline(userId, false, now);
        } catch (RuntimeException e) {
            logger.error("Failed to store offline state for user {}", userId, e);
        }

        presencePublisher.publish(userId, PresenceStatus.OFFLINE, now);
    }

    public boolean isOnline(String userId) {
        return connectionRegistry.isOnline(userId);
    }
}
