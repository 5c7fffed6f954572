package com.hello.chatrealtime.model;

import java.util.Objects;

/**
 * Identifies a channel or a direct-message conversation.
 */
public record RoomKey(RoomType type, String id) {

    public RoomKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    public static RoomKey channel(String channelId) {
        return new RoomKey(RoomType.CHANNEL, channelId);
    }

    public static RoomKey dm(String dmId) {
        return new RoomKey(RoomType.DM, dmId);
    }

    public boolean isChannel() {
        return type == RoomType.CHANNEL;
    }

    @Override
    public String toString() {
        return (isChannel() ? "channel:" : "dm:") + id;
    }
}
