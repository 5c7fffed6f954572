package com.hello.chatrealtime.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks the live connection of every online user. This map is the single source
 * of truth for "is user online". A user has at most one connection: registering
 * again supersedes the previous one.
 */
@Component
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicLong versions = new AtomicLong();

    /**
     * Result of a registration: the new connection and the one it replaced, if any.
     */
    public record Registration(Connection connection, Optional<Connection> replaced) {
    }

    public Registration register(String userId, ConnectionHandle handle, Instant authenticatedAt) {
        Connection connection = new Connection(userId, handle, authenticatedAt, versions.incrementAndGet());
        Connection previous = connections.put(userId, connection);
        if (previous != null) {
            previous.supersede();
            logger.info("Connection {} of user {} replaced by {}", previous.getHandle().getId(), userId,
                    handle.getId());
        }
        return new Registration(connection, Optional.ofNullable(previous));
    }

    /**
     * Removes the registry entry only if it still points at {@code connection}.
     * A stale connection closing after a reconnect leaves the newer entry alone.
     *
     * @return true if the entry was removed by this call
     */
    public boolean unregister(Connection connection) {
        return connections.remove(connection.getUserId(), connection);
    }

    public boolean isCurrent(Connection connection) {
        return connections.get(connection.getUserId()) == connection;
    }

    public Optional<Connection> find(String userId) {
        return Optional.ofNullable(connections.get(userId));
    }

    public boolean isOnline(String userId) {
        return connections.containsKey(userId);
    }

    public List<Connection> getAllConnections() {
        return List.copyOf(connections.values());
    }

    public int getConnectionCount() {
        return connections.size();
    }
}
