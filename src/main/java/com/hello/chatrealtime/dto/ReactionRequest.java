package com.hello.chatrealtime.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class ReactionRequest extends RoomScopedRequest {
    @NotBlank(message = "messageId is required")
    private String messageId;
    @NotBlank(message = "emoji is required")
    private String emoji;
    private String action;
}
