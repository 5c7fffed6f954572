package com.hello.chatrealtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PresenceStatus {

    ONLINE("online"),
    OFFLINE("offline");

    private final String wireName;

    PresenceStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
