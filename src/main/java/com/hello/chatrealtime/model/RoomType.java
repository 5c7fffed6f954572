package com.hello.chatrealtime.model;

/**
 * Kind of room a live set belongs to. Channels and direct messages share the same
 * relay logic but use different wire names for their ids and outbound events.
 */
public enum RoomType {

    CHANNEL("channel", "joined_channel", "typing", "new_message", "message_edited", "message_deleted",
            "reaction_update", "message_status_update"),
    DM("DM", "joined_dm", "dm_typing", "new_dm_message", "dm_message_edited", "dm_message_deleted",
            "dm_reaction_update", "dm_message_status_update");

    private final String displayName;
    private final String joinedEvent;
    private final String typingEvent;
    private final String newMessageEvent;
    private final String messageEditedEvent;
    private final String messageDeletedEvent;
    private final String reactionEvent;
    private final String statusUpdateEvent;

    RoomType(String displayName, String joinedEvent, String typingEvent, String newMessageEvent,
            String messageEditedEvent, String messageDeletedEvent, String reactionEvent, String statusUpdateEvent) {
        this.displayName = displayName;
        this.joinedEvent = joinedEvent;
        this.typingEvent = typingEvent;
        this.newMessageEvent = newMessageEvent;
        this.messageEditedEvent = messageEditedEvent;
        this.messageDeletedEvent = messageDeletedEvent;
        this.reactionEvent = reactionEvent;
        this.statusUpdateEvent = statusUpdateEvent;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getJoinedEvent() {
        return joinedEvent;
    }

    public String getTypingEvent() {
        return typingEvent;
    }

    public String getNewMessageEvent() {
        return newMessageEvent;
    }

    public String getMessageEditedEvent() {
        return messageEditedEvent;
    }

    public String getMessageDeletedEvent() {
        return messageDeletedEvent;
    }

    public String getReactionEvent() {
        return reactionEvent;
    }

    public String getStatusUpdateEvent() {
        return statusUpdateEvent;
    }
}
