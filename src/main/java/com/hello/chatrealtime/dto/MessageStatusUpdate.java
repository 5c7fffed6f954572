package com.hello.chatrealtime.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hello.chatrealtime.model.MessageStatus;
import com.hello.chatrealtime.model.RoomKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageStatusUpdate {
    private String messageId;
    private String channelId;
    private String dmId;
    private MessageStatus status;
    private Instant deliveredAt;
    private Instant readAt;

    public static MessageStatusUpdate of(String messageId, RoomKey room, MessageStatus status, Instant at) {
        MessageStatusUpdateBuilder builder = builder()
                .messageId(messageId)
                .status(status);
        if (room.isChannel()) {
            builder.channelId(room.id());
        } else {
            builder.dmId(room.id());
        }
        if (status == MessageStatus.READ) {
            builder.readAt(at);
        } else {
            builder.deliveredAt(at);
        }
        return builder.build();
    }
}
