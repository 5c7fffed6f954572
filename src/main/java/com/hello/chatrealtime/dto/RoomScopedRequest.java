package com.hello.chatrealtime.dto;

import com.hello.chatrealtime.exception.InvalidEventException;
import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.model.RoomType;
import lombok.Data;

/**
 * Base for inbound payloads addressed to a channel or a DM. Channel events carry
 * {@code channelId}, DM events carry {@code dmId}.
 */
@Data
public class RoomScopedRequest {
    private String channelId;
    private String dmId;

    public RoomKey requireRoom(RoomType type) {
        String id = type == RoomType.CHANNEL ? channelId : dmId;
        if (id == null || id.isBlank()) {
            throw new InvalidEventException((type == RoomType.CHANNEL ? "channelId" : "dmId") + " is required");
        }
        return new RoomKey(type, id);
    }
}
