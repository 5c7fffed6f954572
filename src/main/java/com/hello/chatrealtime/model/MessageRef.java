package com.hello.chatrealtime.model;

/**
 * Minimal view of a persisted message: enough to route a status notification
 * back to its sender.
 */
public record MessageRef(String messageId, String senderId, RoomKey room) {
}
