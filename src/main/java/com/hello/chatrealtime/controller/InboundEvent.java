package com.hello.chatrealtime.controller;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Client-to-server event names. Join events carry the message sent back when the
 * join fails for a reason other than membership.
 */
public enum InboundEvent {

    JOIN_CHANNEL("join_channel", "Failed to join channel"),
    LEAVE_CHANNEL("leave_channel"),
    JOIN_DM("join_dm", "Failed to join DM"),
    LEAVE_DM("leave_dm"),
    TYPING("typing"),
    DM_TYPING("dm_typing"),
    NEW_MESSAGE("new_message"),
    MESSAGE_EDITED("message_edited"),
    MESSAGE_DELETED("message_deleted"),
    NEW_DM_MESSAGE("new_dm_message"),
    DM_MESSAGE_EDITED("dm_message_edited"),
    DM_MESSAGE_DELETED("dm_message_deleted"),
    REACTION_UPDATE("reaction_update"),
    DM_REACTION_UPDATE("dm_reaction_update"),
    MESSAGES_DELIVERED("messages_delivered"),
    MESSAGES_READ("messages_read"),
    DM_MESSAGES_DELIVERED("dm_messages_delivered"),
    DM_MESSAGES_READ("dm_messages_read"),
    CALL_INITIATE("call_initiate"),
    CALL_ACCEPT("call_accept"),
    CALL_REJECT("call_reject"),
    CALL_END("call_end"),
    CALL_OFFER("call_offer"),
    CALL_ANSWER("call_answer"),
    ICE_CANDIDATE("ice_candidate"),
    CALL_TOGGLE_MEDIA("call_toggle_media");

    private static final Map<String, InboundEvent> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(InboundEvent::getWireName, Function.identity()));

    private final String wireName;
    private final String failureMessage;

    InboundEvent(String wireName) {
        this(wireName, null);
    }

    InboundEvent(String wireName, String failureMessage) {
        this.wireName = wireName;
        this.failureMessage = failureMessage;
    }

    public String getWireName() {
        return wireName;
    }

    public Optional<String> getFailureMessage() {
        return Optional.ofNullable(failureMessage);
    }

    public static Optional<InboundEvent> fromWireName(String name) {
        return Optional.ofNullable(name).map(BY_WIRE_NAME::get);
    }
}
