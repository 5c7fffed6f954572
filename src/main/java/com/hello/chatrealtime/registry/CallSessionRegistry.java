package com.hello.chatrealtime.registry;

import com.hello.chatrealtime.model.CallSession;
import com.hello.chatrealtime.model.CallState;
import com.hello.chatrealtime.model.MediaKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Table of active call sessions keyed by call id. Every removal goes through
 * {@link Map#remove(Object)} or a compute call, so a session is handed out for
 * teardown exactly once no matter how many threads race for it.
 */
@Component
public class CallSessionRegistry {

    private final Map<String, CallSession> sessions = new ConcurrentHashMap<>();

    public CallSession create(String callerId, String receiverId, MediaKind kind, String channelId,
            Instant createdAt) {
        CallSession session = CallSession.builder()
                .callId(UUID.randomUUID().toString())
                .callerId(callerId)
                .receiverId(receiverId)
                .kind(kind)
                .channelId(channelId)
                .createdAt(createdAt)
                .state(CallState.RINGING)
                .build();
        sessions.put(session.getCallId(), session);
        return session;
    }

    public Optional<CallSession> find(String callId) {
        return Optional.ofNullable(sessions.get(callId));
    }

    /**
     * Moves a ringing session to ACCEPTED if {@code userId} is its receiver.
     *
     * @return the accepted session, or empty if the call is gone, already
     *         accepted, or was not addressed to this user
     */
    public Optional<CallSession> accept(String callId, String userId) {
        AtomicReference<CallSession> accepted = new AtomicReference<>();
        sessions.computeIfPresent(callId, (id, session) -> {
            if (session.getState() != CallState.RINGING || !session.getReceiverId().equals(userId)) {
                return session;
            }
            CallSession next = session.withState(CallState.ACCEPTED);
            accepted.set(next);
            return next;
        });
        return Optional.ofNullable(accepted.get());
    }

    public Optional<CallSession> remove(String callId) {
        return Optional.ofNullable(sessions.remove(callId));
    }

    /**
     * Removes the session if {@code userId} is one of its two parties.
     */
    public Optional<CallSession> removeIfParticipant(String callId, String userId) {
        AtomicReference<CallSession> removed = new AtomicReference<>();
        sessions.computeIfPresent(callId, (id, session) -> {
            if (!session.involves(userId)) {
                return session;
            }
            removed.set(session);
            return null;
        });
        return Optional.ofNullable(removed.get());
    }

    /**
     * Removes every session that references the user.
     *
     * @return the sessions this call removed; a session removed concurrently by
     *         another thread is not included
     */
    public List<CallSession> removeAllInvolving(String userId) {
        List<CallSession> removed = new ArrayList<>();
        for (CallSession session : sessions.values()) {
            if (session.involves(userId) && sessions.remove(session.getCallId(), session)) {
                removed.add(session);
            } else if (session.involves(userId)) {
                // replaced by a state change in the meantime
                removeIfParticipant(session.getCallId(), userId).ifPresent(removed::add);
            }
        }
        return removed;
    }

    public int getActiveCount() {
        return sessions.size();
    }
}
