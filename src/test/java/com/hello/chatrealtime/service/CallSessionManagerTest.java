package com.hello.chatrealtime.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.hello.chatrealtime.dto.CallEvent;
import com.hello.chatrealtime.exception.InvalidEventException;
import com.hello.chatrealtime.model.CallSession;
import com.hello.chatrealtime.model.CallState;
import com.hello.chatrealtime.model.MediaKind;
import com.hello.chatrealtime.support.RealtimeFixture;
import com.hello.chatrealtime.support.TestClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.hello.chatrealtime.service.CallSessionManager.CALL_ACCEPTED;
import static com.hello.chatrealtime.service.CallSessionManager.CALL_ANSWER;
import static com.hello.chatrealtime.service.CallSessionManager.CALL_ENDED;
import static com.hello.chatrealtime.service.CallSessionManager.CALL_FAILED;
import static com.hello.chatrealtime.service.CallSessionManager.CALL_INCOMING;
import static com.hello.chatrealtime.service.CallSessionManager.CALL_INITIATED;
import static com.hello.chatrealtime.service.CallSessionManager.CALL_MEDIA_TOGGLED;
import static com.hello.chatrealtime.service.CallSessionManager.CALL_OFFER;
import static com.hello.chatrealtime.service.CallSessionManager.CALL_REJECTED;
import static com.hello.chatrealtime.service.CallSessionManager.ICE_CANDIDATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.when;

class CallSessionManagerTest {

    private RealtimeFixture fixture;
    private CallSessionManager calls;
    private TestClient alice;
    private TestClient bob;
    private TestClient mallory;

    @BeforeEach
    void setUp() {
        fixture = new RealtimeFixture();
        calls = fixture.callSessionManager;
        alice = fixture.connect("alice");
        bob = fixture.connect("bob");
        mallory = fixture.connect("mallory");
        alice.clear();
        bob.clear();
        mallory.clear();
    }

    private String ring() {
        return calls.initiate("alice", "bob", "video", "general").orElseThrow().getCallId();
    }

    @Test
    void initiateRingsReceiverAndConfirmsToCaller() {
        CallSession session = calls.initiate("alice", "bob", "video", "general").orElseThrow();

        assertThat(session.getState()).isEqualTo(CallState.RINGING);
        assertThat(bob.received(CALL_INCOMING, CallEvent.class))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getCallId()).isEqualTo(session.getCallId());
                    assertThat(event.getCallerId()).isEqualTo("alice");
                    assertThat(event.getType()).isEqualTo(MediaKind.VIDEO);
                    assertThat(event.getChannelId()).isEqualTo("general");
                });
        assertThat(alice.received(CALL_INITIATED, CallEvent.class))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getCallId()).isEqualTo(session.getCallId());
                    assertThat(event.getReceiverId()).isEqualTo("bob");
                });
        assertThat(calls.getActiveCallCount()).isEqualTo(1);
    }

    @Test
    void unknownReceiverFailsWithoutSession() {
        when(fixture.gateway.userExists("ghost")).thenReturn(false);

        assertThat(calls.initiate("alice", "ghost", "audio", null)).isEmpty();

        assertThat(alice.received(CALL_FAILED, CallEvent.class))
                .singleElement()
                .satisfies(event -> assertThat(event.getReason()).isEqualTo("User not found"));
        assertThat(calls.getActiveCallCount()).isZero();
    }

    @Test
    void callerDisconnectingWhileCallIsPlacedLeavesNoSession() {
        when(fixture.gateway.userExists("bob")).thenAnswer(invocation -> {
            alice.disconnect();
            return true;
        });
        bob.clear();

        assertThat(calls.initiate("alice", "bob", "audio", null)).isEmpty();

        assertThat(calls.getActiveCallCount()).isZero();
        assertThat(bob.count(CALL_INCOMING)).isZero();
        assertThat(bob.count(CALL_ENDED)).isZero();
    }

    @Test
    void invalidInitiateRequestsAreRejected() {
        assertThatThrownBy(() -> calls.initiate("alice", "bob", "hologram", null))
                .isInstanceOf(InvalidEventException.class)
                .hasMessage("Call type must be audio or video");
        assertThatThrownBy(() -> calls.initiate("alice", "alice", "audio", null))
                .isInstanceOf(InvalidEventException.class)
                .hasMessage("Cannot call yourself");
        assertThat(calls.getActiveCallCount()).isZero();
    }

    @Test
    void onlyReceiverCanAccept() {
        String callId = ring();

        calls.accept("alice", callId);
        calls.accept("mallory", callId);
        assertThat(alice.count(CALL_ACCEPTED)).isZero();

        calls.accept("bob", callId);
        calls.accept("bob", callId);
        assertThat(alice.received(CALL_ACCEPTED, CallEvent.class))
                .singleElement()
                .satisfies(event -> assertThat(event.getAcceptedBy()).isEqualTo("bob"));
    }

    @Test
    void rejectDestroysSessionAndTellsTheOtherParty() {
        String callId = ring();

        calls.reject("bob", callId, null);

        assertThat(alice.received(CALL_REJECTED, CallEvent.class))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getRejectedBy()).isEqualTo("bob");
                    assertThat(event.getReason()).isEqualTo("Call declined");
                });
        assertThat(calls.getActiveCallCount()).isZero();

        calls.accept("bob", callId);
        assertThat(alice.count(CALL_ACCEPTED)).isZero();
    }

    @Test
    void callerCanCancelWithReason() {
        String callId = ring();

        calls.reject("alice", callId, "Busy");

        assertThat(bob.received(CALL_REJECTED, CallEvent.class))
                .extracting(CallEvent::getReason)
                .containsExactly("Busy");
    }

    @Test
    void outsiderCannotEndCall() {
        String callId = ring();

        calls.end("mallory", callId);

        assertThat(calls.getActiveCallCount()).isEqualTo(1);
        assertThat(alice.count(CALL_ENDED)).isZero();
        assertThat(bob.count(CALL_ENDED)).isZero();
    }

    @Test
    void endNotifiesOtherPartyOnlyOnce() {
        String callId = ring();
        calls.accept("bob", callId);

        calls.end("bob", callId);
        calls.end("alice", callId);

        assertThat(alice.received(CALL_ENDED, CallEvent.class))
                .singleElement()
                .satisfies(event -> assertThat(event.getEndedBy()).isEqualTo("bob"));
        assertThat(bob.count(CALL_ENDED)).isZero();
    }

    @Test
    void signalingIsForwardedVerbatimToTheOtherParty() {
        String callId = ring();
        calls.accept("bob", callId);
        JsonNode offer = fixture.json("{'type':'offer','sdp':'v=0'}");
        JsonNode answer = fixture.json("{'type':'answer','sdp':'v=0'}");
        JsonNode candidate = fixture.json("{'candidate':'candidate:1 1 udp','sdpMLineIndex':0}");

        calls.offer("alice", callId, offer);
        calls.answer("bob", callId, answer);
        calls.iceCandidate("bob", callId, candidate);
        calls.toggleMedia("alice", callId, "audio", false);

        assertThat(bob.received(CALL_OFFER, CallEvent.class))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getOffer()).isEqualTo(offer);
                    assertThat(event.getCallerId()).isEqualTo("alice");
                });
        assertThat(alice.received(CALL_ANSWER, CallEvent.class))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getAnswer()).isEqualTo(answer);
                    assertThat(event.getAnswererId()).isEqualTo("bob");
                });
        assertThat(alice.received(ICE_CANDIDATE, CallEvent.class))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getCandidate()).isEqualTo(candidate);
                    assertThat(event.getFrom()).isEqualTo("bob");
                });
        assertThat(bob.received(CALL_MEDIA_TOGGLED, CallEvent.class))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getUserId()).isEqualTo("alice");
                    assertThat(event.getMediaType()).isEqualTo("audio");
                    assertThat(event.getEnabled()).isFalse();
                });
    }

    @Test
    void signalingFromOutsiderOrForUnknownCallIsDropped() {
        String callId = ring();

        calls.iceCandidate("mallory", callId, fixture.json("{'candidate':'x'}"));
        calls.offer("alice", "no-such-call", fixture.json("{'sdp':'x'}"));

        assertThat(alice.eventNames()).containsExactly(CALL_INITIATED);
        assertThat(bob.eventNames()).containsExactly(CALL_INCOMING);
        assertThat(mallory.eventNames()).isEmpty();
    }

    @Test
    void endAllForReleasesEveryCallOfTheUser() {
        String first = ring();
        String second = calls.initiate("mallory", "alice", "audio", null).orElseThrow().getCallId();

        calls.endAllFor("alice");

        assertThat(bob.received(CALL_ENDED, CallEvent.class))
                .extracting(CallEvent::getCallId, CallEvent::getReason)
                .containsExactly(tuple(first, "disconnected"));
        assertThat(mallory.received(CALL_ENDED, CallEvent.class))
                .extracting(CallEvent::getCallId)
                .containsExactly(second);
        assertThat(calls.getActiveCallCount()).isZero();
    }
}
