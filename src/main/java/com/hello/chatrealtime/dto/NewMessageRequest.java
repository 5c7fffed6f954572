package com.hello.chatrealtime.dto;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Announcement of a message the persistence service has already stored. The
 * message body is relayed as-is.
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class NewMessageRequest extends RoomScopedRequest {
    @NotNull(message = "message is required")
    private ObjectNode message;
}
