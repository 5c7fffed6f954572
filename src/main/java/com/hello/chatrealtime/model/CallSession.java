package com.hello.chatrealtime.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * One call attempt between exactly two users. Instances are immutable; a state
 * change replaces the stored instance.
 */
@Value
@Builder
public class CallSession {

    String callId;
    String callerId;
    String receiverId;
    MediaKind kind;
    String channelId;
    Instant createdAt;
    @With
    CallState state;

    public boolean involves(String userId) {
        return callerId.equals(userId) || receiverId.equals(userId);
    }

    /**
     * Returns the party that is not {@code userId}. Callers must check
     * {@link #involves(String)} first.
     */
    public String otherParty(String userId) {
        return callerId.equals(userId) ? receiverId : callerId;
    }
}
