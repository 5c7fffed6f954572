package com.hello.chatrealtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery state of a persisted message. Declaration order is the only legal
 * direction of travel: a message never moves back to an earlier constant.
 */
public enum MessageStatus {

    SENT("sent"),
    DELIVERED("delivered"),
    READ("read");

    private final String wireName;

    MessageStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isBefore(MessageStatus other) {
        return compareTo(other) < 0;
    }
}
