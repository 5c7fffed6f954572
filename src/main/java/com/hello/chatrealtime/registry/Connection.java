package com.hello.chatrealtime.registry;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A registered connection for one user. Each registration gets a new version so
 * a handle replaced by a reconnect can be told apart from the current one.
 */
public class Connection {

    private final String userId;
    private final ConnectionHandle handle;
    private final Instant authenticatedAt;
    private final long version;

    private final AtomicBoolean superseded = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    Connection(String userId, ConnectionHandle handle, Instant authenticatedAt, long version) {
        this.userId = userId;
        this.handle = handle;
        this.authenticatedAt = authenticatedAt;
        this.version = version;
    }

    public String getUserId() {
        return userId;
    }

    public ConnectionHandle getHandle() {
        return handle;
    }

    public Instant getAuthenticatedAt() {
        return authenticatedAt;
    }

    public long getVersion() {
        return version;
    }

    public boolean isSuperseded() {
        return superseded.get();
    }

    void supersede() {
        superseded.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Flags the connection as closed. Returns true only for the first caller, which
     * owns the disconnect teardown.
     */
    public boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    public void send(String event, Object payload) {
        if (!closed.get() && handle.isOpen()) {
            handle.send(event, payload);
        }
    }

    @Override
    public String toString() {
        return "Connection{userId=" + userId + ", handle=" + handle.getId() + ", version=" + version + "}";
    }
}
