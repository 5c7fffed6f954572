package com.hello.chatrealtime.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.hello.chatrealtime.model.MediaKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound payload of every call_* event and ice_candidate. Signaling payloads
 * (offer, answer, candidate) are passed through untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallEvent {
    private String callId;
    private String callerId;
    private String receiverId;
    private MediaKind type;
    private String channelId;
    private String acceptedBy;
    private String rejectedBy;
    private String endedBy;
    private String reason;
    private JsonNode offer;
    private JsonNode answer;
    private String answererId;
    private JsonNode candidate;
    private String from;
    private String userId;
    private String mediaType;
    private Boolean enabled;
}
