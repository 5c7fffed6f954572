package com.hello.chatrealtime.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.hello.chatrealtime.dto.CallEvent;
import com.hello.chatrealtime.exception.InvalidEventException;
import com.hello.chatrealtime.model.CallSession;
import com.hello.chatrealtime.model.CallState;
import com.hello.chatrealtime.model.MediaKind;
import com.hello.chatrealtime.persistence.ChatPersistenceGateway;
import com.hello.chatrealtime.registry.CallSessionRegistry;
import com.hello.chatrealtime.registry.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Call signaling between two users.
 *
 * <p>A session starts RINGING on initiate, becomes ACCEPTED when the receiver
 * accepts, and is destroyed on reject, end, or the disconnect of either party.
 * There is no ring timeout: an unanswered call stays RINGING until one of those
 * happens.
 *
 * <p>SDP offers, answers and ICE candidates are forwarded verbatim to the other
 * party. Any event naming an unknown call, or sent by a user who is not a party
 * to the call, is ignored: the call may have ended while the event was in flight.
 */
@Service
public class CallSessionManager {

    public static final String CALL_INCOMING = "call_incoming";
    public static final String CALL_INITIATED = "call_initiated";
    public static final String CALL_FAILED = "call_failed";
    public static final String CALL_ACCEPTED = "call_accepted";
    public static final String CALL_REJECTED = "call_rejected";
    public static final String CALL_ENDED = "call_ended";
    public static final String CALL_OFFER = "call_offer";
    public static final String CALL_ANSWER = "call_answer";
    public static final String ICE_CANDIDATE = "ice_candidate";
    public static final String CALL_MEDIA_TOGGLED = "call_media_toggled";

    static final String REASON_OFFLINE = "User is offline";
    static final String REASON_UNKNOWN_USER = "User not found";
    static final String REASON_DECLINED = "Call declined";
    static final String REASON_DISCONNECTED = "disconnected";

    private static final Logger logger = LoggerFactory.getLogger(CallSessionManager.class);

    private final CallSessionRegistry callSessionRegistry;
    private final ConnectionRegistry connectionRegistry;
    private final ChatPersistenceGateway persistenceGateway;
    private final EventBroadcaster broadcaster;
    private final Clock clock;

    public CallSessionManager(CallSessionRegistry callSessionRegistry,
            ConnectionRegistry connectionRegistry,
            ChatPersistenceGateway persistenceGateway,
            EventBroadcaster broadcaster,
            Clock clock) {
        this.callSessionRegistry = callSessionRegistry;
        this.connectionRegistry = connectionRegistry;
        this.persistenceGateway = persistenceGateway;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    /**
     * Rings the receiver. If the receiver is offline the caller gets
     * {@code call_failed} and no session is kept. If the caller disconnected while
     * the call was being placed, the session is dropped without ringing anyone.
     *
     * @return the ringing session, or empty if the call could not be placed
     */
    public Optional<CallSession> initiate(String callerId, String receiverId, String type, String channelId) {
        MediaKind kind = MediaKind.fromWireName(type)
                .orElseThrow(() -> new InvalidEventException("Call type must be audio or video"));
        if (callerId.equals(receiverId)) {
            throw new InvalidEventException("Cannot call yourself");
        }
        if (!persistenceGateway.userExists(receiverId)) {
            broadcaster.sendToUser(callerId, CALL_FAILED, CallEvent.builder()
                    .receiverId(receiverId)
                    .reason(REASON_UNKNOWN_USER)
                    .build());
            return Optional.empty();
        }

        CallSession session = callSessionRegistry.create(callerId, receiverId, kind, channelId, clock.instant());
        // endAllFor may already have run for the caller
        if (!connectionRegistry.isOnline(callerId)) {
            callSessionRegistry.remove(session.getCallId());
            logger.debug("Dropped call {} from {}: caller disconnected", session.getCallId(), callerId);
            return Optional.empty();
        }

        boolean rung = broadcaster.sendToUser(receiverId, CALL_INCOMING, CallEvent.builder()
                .callId(session.getCallId())
                .callerId(callerId)
                .type(kind)
                .channelId(channelId)
                .build());
        if (!rung) {
            callSessionRegistry.remove(session.getCallId());
            logger.info("Call {} from {} to {} {}: receiver offline", session.getCallId(), callerId, receiverId,
                    CallState.FAILED);
            broadcaster.sendToUser(callerId, CALL_FAILED, CallEvent.builder()
                    .callId(session.getCallId())
                    .reason(REASON_OFFLINE)
                    .build());
            return Optional.empty();
        }

        logger.info("Call {} from {} to {} {}", session.getCallId(), callerId, receiverId, CallState.RINGING);
        broadcaster.sendToUser(callerId, CALL_INITIATED, CallEvent.builder()
                .callId(session.getCallId())
                .receiverId(receiverId)
                .type(kind)
                .build());
        return Optional.of(session);
    }

    public void accept(String userId, String callId) {
        Optional<CallSession> accepted = callSessionRegistry.accept(callId, userId);
        if (accepted.isEmpty()) {
            logger.debug("Ignoring call_accept for {} from {}", callId, userId);
            return;
        }
        CallSession session = accepted.get();
        logger.info("Call {} {}", callId, CallState.ACCEPTED);
        broadcaster.sendToUser(session.getCallerId(), CALL_ACCEPTED, CallEvent.builder()
                .callId(callId)
                .acceptedBy(userId)
                .build());
    }

    public void reject(String userId, String callId, String reason) {
        Optional<CallSession> removed = callSessionRegistry.removeIfParticipant(callId, userId);
        if (removed.isEmpty()) {
            logger.debug("Ignoring call_reject for {} from {}", callId, userId);
            return;
        }
        logger.info("Call {} {} by {}", callId, CallState.REJECTED, userId);
        broadcaster.sendToUser(removed.get().otherParty(userId), CALL_REJECTED, CallEvent.builder()
                .callId(callId)
                .rejectedBy(userId)
                .reason(reason == null || reason.isBlank() ? REASON_DECLINED : reason)
                .build());
    }

    public void end(String userId, String callId) {
        Optional<CallSession> removed = callSessionRegistry.removeIfParticipant(callId, userId);
        if (removed.isEmpty()) {
            logger.debug("Ignoring call_end for {} from {}", callId, userId);
            return;
        }
        logger.info("Call {} {} by {}", callId, CallState.ENDED, userId);
        broadcaster.sendToUser(removed.get().otherParty(userId), CALL_ENDED, CallEvent.builder()
                .callId(callId)
                .endedBy(userId)
                .build());
    }

    public void offer(String userId, String callId, JsonNode offer) {
        forward(userId, callId, CALL_OFFER, CallEvent.builder()
                .callId(callId)
                .offer(offer)
                .callerId(userId)
                .build());
    }

    public void answer(String userId, String callId, JsonNode answer) {
        forward(userId, callId, CALL_ANSWER, CallEvent.builder()
                .callId(callId)
                .answer(answer)
                .answererId(userId)
                .build());
    }

    public void iceCandidate(String userId, String callId, JsonNode candidate) {
        forward(userId, callId, ICE_CANDIDATE, CallEvent.builder()
                .callId(callId)
                .candidate(candidate)
                .from(userId)
                .build());
    }

    public void toggleMedia(String userId, String callId, String mediaType, Boolean enabled) {
        forward(userId, callId, CALL_MEDIA_TOGGLED, CallEvent.builder()
                .callId(callId)
                .userId(userId)
                .mediaType(mediaType)
                .enabled(enabled)
                .build());
    }

    /**
     * Ends every call the user is part of, telling each surviving party once.
     */
    public void endAllFor(String userId) {
        List<CallSession> removed = callSessionRegistry.removeAllInvolving(userId);
        for (CallSession session : removed) {
            String otherParty = session.otherParty(userId);
            logger.info("Call {} {}: {} disconnected", session.getCallId(), CallState.ENDED, userId);
            broadcaster.sendToUser(otherParty, CALL_ENDED, CallEvent.builder()
                    .callId(session.getCallId())
                    .endedBy(userId)
                    .reason(REASON_DISCONNECTED)
                    .build());
        }
    }

    public int getActiveCallCount() {
        return callSessionRegistry.getActiveCount();
    }

    private void forward(String userId, String callId, String event, CallEvent payload) {
        Optional<CallSession> session = callSessionRegistry.find(callId).filter(s -> s.involves(userId));
        if (session.isEmpty()) {
            logger.debug("Ignoring {} for {} from {}", event, callId, userId);
            return;
        }
        broadcaster.sendToUser(session.get().otherParty(userId), event, payload);
    }
}
