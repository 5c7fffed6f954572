package com.hello.chatrealtime.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Payload of the edit and delete events. {@code text} is only set for edits.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class MessageChangeRequest extends RoomScopedRequest {
    @NotBlank(message = "messageId is required")
    private String messageId;
    private String text;
}
