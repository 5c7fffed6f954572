package com.hello.chatrealtime.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
public class MessageStatusRequest extends RoomScopedRequest {
    @NotNull(message = "messageIds is required")
    private List<String> messageIds;
}
