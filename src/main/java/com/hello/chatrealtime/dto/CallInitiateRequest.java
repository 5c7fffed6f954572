package com.hello.chatrealtime.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CallInitiateRequest {
    @NotBlank(message = "receiverId is required")
    private String receiverId;
    @NotBlank(message = "type is required")
    private String type;
    private String channelId;
}
