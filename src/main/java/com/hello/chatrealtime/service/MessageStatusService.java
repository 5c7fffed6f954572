package com.hello.chatrealtime.service;

import com.hello.chatrealtime.dto.MessageStatusUpdate;
import com.hello.chatrealtime.exception.InvalidEventException;
import com.hello.chatrealtime.exception.NotAMemberException;
import com.hello.chatrealtime.model.MessageRef;
import com.hello.chatrealtime.model.MessageStatus;
import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.persistence.ChatPersistenceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides when persisted messages move forward through sent, delivered and read,
 * and tells the original senders. Only messages that actually moved are
 * reported, so a sender never sees a status older than one it was already sent.
 * Storage failures are logged and the update is dropped.
 */
@Service
public class MessageStatusService {

    private static final Logger logger = LoggerFactory.getLogger(MessageStatusService.class);

    private final ChatPersistenceGateway persistenceGateway;
    private final EventBroadcaster broadcaster;
    private final Clock clock;

    public MessageStatusService(ChatPersistenceGateway persistenceGateway, EventBroadcaster broadcaster, Clock clock) {
        this.persistenceGateway = persistenceGateway;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    /**
     * Handles a client's acknowledgement that it has received or read a batch of
     * messages in one room.
     *
     * @param kind DELIVERED or READ
     * @throws NotAMemberException if the requester is not a persisted member of the room
     */
    public void onBulkStatusUpdate(MessageStatus kind, RoomKey room, Collection<String> messageIds,
            String requesterId) {
        if (kind == MessageStatus.SENT) {
            throw new InvalidEventException("Status update must be delivered or read");
        }
        Set<String> ids = messageIds.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (ids.isEmpty()) {
            return;
        }
        if (!persistenceGateway.isMember(requesterId, room)) {
            throw new NotAMemberException(room);
        }

        Instant now = clock.instant();
        List<MessageRef> advanced;
        try {
            List<MessageRef> candidates = persistenceGateway.findMessagesBelowStatus(room, ids, kind, requesterId);
            advanced = candidates.isEmpty()
                    ? List.of()
                    : movedOnly(candidates, persistenceGateway.updateMessageStatus(idsOf(candidates), kind, now));
            if (kind == MessageStatus.READ) {
                persistenceGateway.updateLastRead(requesterId, room, now);
            }
        } catch (RuntimeException e) {
            logger.error("Failed to mark {} messages {} in {} for user {}", ids.size(), kind.getWireName(), room,
                    requesterId, e);
            return;
        }

        notifySenders(advanced, kind, now);
    }

    /**
     * Moves every message waiting for a freshly connected user from sent to
     * delivered and tells each sender that is online.
     */
    public void deliverPendingMessages(String userId) {
        Instant now = clock.instant();
        List<MessageRef> pending;
        try {
            pending = persistenceGateway.findUndeliveredMessages(userId);
            if (pending.isEmpty()) {
                return;
            }
            pending = movedOnly(pending,
                    persistenceGateway.updateMessageStatus(idsOf(pending), MessageStatus.DELIVERED, now));
        } catch (RuntimeException e) {
            logger.error("Failed to update delivery status of pending messages for user {}", userId, e);
            return;
        }

        logger.debug("Marked {} pending messages delivered for user {}", pending.size(), userId);
        notifySenders(pending, MessageStatus.DELIVERED, now);
    }

    /**
     * A new message reached at least one other live member of its room: record it
     * as delivered and tell the sender. Only a message of {@code senderId} stored
     * in {@code room} is touched. Nothing is sent when storage reports no such
     * message still at {@code sent}.
     */
    public void onRelayedToLiveMembers(String senderId, RoomKey room, String messageId) {
        Instant now = clock.instant();
        try {
            if (!persistenceGateway.markDeliveredIfSentBy(room, senderId, messageId, now)) {
                logger.debug("Message {} of {} in {} not moved to delivered", messageId, senderId, room);
                return;
            }
        } catch (RuntimeException e) {
            // the sender is still told: the recipients are connected to the room
            logger.error("Failed to persist delivery of message {} in {}", messageId, room, e);
        }
        broadcaster.sendToUser(senderId, room.type().getStatusUpdateEvent(),
                MessageStatusUpdate.of(messageId, room, MessageStatus.DELIVERED, now));
    }

    private void notifySenders(List<MessageRef> messages, MessageStatus status, Instant at) {
        for (MessageRef message : messages) {
            broadcaster.sendToUser(message.senderId(), message.room().type().getStatusUpdateEvent(),
                    MessageStatusUpdate.of(message.messageId(), message.room(), status, at));
        }
    }

    private static List<MessageRef> movedOnly(List<MessageRef> messages, Collection<String> movedIds) {
        Set<String> moved = Set.copyOf(movedIds);
        return messages.stream().filter(m -> moved.contains(m.messageId())).collect(Collectors.toList());
    }

    private static List<String> idsOf(List<MessageRef> messages) {
        return messages.stream().map(MessageRef::messageId).collect(Collectors.toList());
    }
}
