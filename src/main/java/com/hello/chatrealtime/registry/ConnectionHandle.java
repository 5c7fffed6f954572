package com.hello.chatrealtime.registry;

/**
 * Transport-side view of one live client connection.
 */
public interface ConnectionHandle {

    String getId();

    boolean isOpen();

    /**
     * Sends one outbound event. Delivery failures are reported by the
     * implementation and never thrown to the caller, so a broken peer cannot
     * abort a fan-out to other peers.
     */
    void send(String event, Object payload);

    void close(int code, String reason);
}
