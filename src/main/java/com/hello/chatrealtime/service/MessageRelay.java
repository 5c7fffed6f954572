package com.hello.chatrealtime.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hello.chatrealtime.dto.RoomEvent;
import com.hello.chatrealtime.dto.UnreadUpdate;
import com.hello.chatrealtime.exception.InvalidEventException;
import com.hello.chatrealtime.exception.NotAMemberException;
import com.hello.chatrealtime.model.MessageStatus;
import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.model.RoomType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Forwards chat events to the other live members of a room. The persistence
 * service has already stored whatever these events describe; the relay only
 * adds delivery tracking for new messages.
 */
@Service
public class MessageRelay {

    public static final String UNREAD_UPDATE = "unread_update";

    private static final Logger logger = LoggerFactory.getLogger(MessageRelay.class);

    private final RoomMembershipService roomMembershipService;
    private final MessageStatusService messageStatusService;
    private final EventBroadcaster broadcaster;

    public MessageRelay(RoomMembershipService roomMembershipService,
            MessageStatusService messageStatusService,
            EventBroadcaster broadcaster) {
        this.roomMembershipService = roomMembershipService;
        this.messageStatusService = messageStatusService;
        this.broadcaster = broadcaster;
    }

    /**
     * Sends {@code payload} to every live member of the room except the sender.
     *
     * @return number of members reached
     * @throws NotAMemberException if the sender has not joined the room's live set
     */
    public int relay(String event, RoomKey room, Object payload, String senderId) {
        return broadcaster.sendToUsers(recipients(room, senderId), event, payload);
    }

    public void typing(String senderId, RoomKey room, boolean isTyping) {
        relay(room.type().getTypingEvent(), room,
                RoomEvent.in(room).userId(senderId).isTyping(isTyping).build(), senderId);
    }

    /**
     * Relays a stored message tagged {@code sent}. If any other member is online in
     * the room the message counts as delivered and the sender is told so.
     */
    public void newMessage(String senderId, RoomKey room, ObjectNode message) {
        JsonNode idNode = message.get("id");
        if (idNode == null || !idNode.isValueNode() || idNode.asText().isBlank()) {
            throw new InvalidEventException("message.id is required");
        }
        String messageId = idNode.asText();

        ObjectNode relayed = message.deepCopy();
        relayed.put("status", MessageStatus.SENT.getWireName());
        Set<String> recipients = recipients(room, senderId);
        int reached = broadcaster.sendToUsers(recipients, room.type().getNewMessageEvent(),
                RoomEvent.in(room).message(relayed).build());
        logger.debug("Message {} from {} relayed to {} members of {}", messageId, senderId, reached, room);

        if (reached == 0) {
            return;
        }
        messageStatusService.onRelayedToLiveMembers(senderId, room, messageId);

        if (room.type() == RoomType.DM) {
            UnreadUpdate unread = UnreadUpdate.builder()
                    .type("dm")
                    .dmId(room.id())
                    .senderId(senderId)
                    .build();
            broadcaster.sendToUsers(recipients, UNREAD_UPDATE, unread);
        }
    }

    /**
     * Snapshot of the room's other live members. One snapshot serves every event a
     * single inbound message fans out to.
     *
     * @throws NotAMemberException if the sender has not joined the room's live set
     */
    private Set<String> recipients(RoomKey room, String senderId) {
        if (!roomMembershipService.isInLiveSet(senderId, room)) {
            throw new NotAMemberException(room);
        }
        Set<String> members = new LinkedHashSet<>(roomMembershipService.listOnlineMembers(room));
        members.remove(senderId);
        return members;
    }

    public void messageEdited(String senderId, RoomKey room, String messageId, String text) {
        relay(room.type().getMessageEditedEvent(), room,
                RoomEvent.in(room).messageId(messageId).text(text).build(), senderId);
    }

    public void messageDeleted(String senderId, RoomKey room, String messageId) {
        relay(room.type().getMessageDeletedEvent(), room,
                RoomEvent.in(room).messageId(messageId).build(), senderId);
    }

    public void reaction(String senderId, RoomKey room, String messageId, String emoji, String action) {
        relay(room.type().getReactionEvent(), room,
                RoomEvent.in(room)
                        .messageId(messageId)
                        .userId(senderId)
                        .emoji(emoji)
                        .action(action)
                        .build(),
                senderId);
    }
}
