package com.hello.chatrealtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum MediaKind {

    AUDIO("audio"),
    VIDEO("video");

    private final String wireName;

    MediaKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<MediaKind> fromWireName(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equals(value))
                .findFirst();
    }
}
