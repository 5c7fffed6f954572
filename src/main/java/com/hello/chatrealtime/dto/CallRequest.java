package com.hello.chatrealtime.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Payload of every event that refers to an existing call. Which of the optional
 * fields is read depends on the event.
 */
@Data
public class CallRequest {
    @NotBlank(message = "callId is required")
    private String callId;
    private String reason;
    private JsonNode offer;
    private JsonNode answer;
    private JsonNode candidate;
    private String mediaType;
    private Boolean enabled;
}
