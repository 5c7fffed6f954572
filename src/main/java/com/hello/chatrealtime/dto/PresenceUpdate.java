package com.hello.chatrealtime.dto;

import com.hello.chatrealtime.model.PresenceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresenceUpdate {
    private String userId;
    private PresenceStatus status;
    private Instant lastActive;
}
