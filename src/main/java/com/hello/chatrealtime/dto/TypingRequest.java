package com.hello.chatrealtime.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
public class TypingRequest extends RoomScopedRequest {
    private Boolean isTyping;
}
