package com.hello.chatrealtime.exception;

import com.hello.chatrealtime.model.RoomKey;

public class NotAMemberException extends ClientEventException {

    private final RoomKey room;

    public NotAMemberException(RoomKey room) {
        super("Not a member of this " + room.type().getDisplayName());
        this.room = room;
    }

    public RoomKey getRoom() {
        return room;
    }
}
