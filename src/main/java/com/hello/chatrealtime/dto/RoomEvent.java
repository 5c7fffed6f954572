package com.hello.chatrealtime.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hello.chatrealtime.model.RoomKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound payload of every room-scoped relay: joins, leaves, typing, messages,
 * edits, deletes and reactions. Only the fields an event uses are serialized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoomEvent {
    private String channelId;
    private String dmId;
    private String userId;
    private Boolean isTyping;
    private ObjectNode message;
    private String messageId;
    private String text;
    private String emoji;
    private String action;

    /**
     * Starts a builder with the room id already placed in the right field.
     */
    public static RoomEventBuilder in(RoomKey room) {
        return room.isChannel() ? builder().channelId(room.id()) : builder().dmId(room.id());
    }
}
