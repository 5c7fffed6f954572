package com.hello.chatrealtime.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire frame in both directions: {@code {"event": "...", "data": {...}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventEnvelope {
    private String event;
    private Object data;

    /**
     * Inbound frames are read as a tree so the dispatcher can bind {@code data}
     * to the request type of the named event.
     */
    @Data
    @NoArgsConstructor
    public static class Inbound {
        private String event;
        private JsonNode data;
    }
}
