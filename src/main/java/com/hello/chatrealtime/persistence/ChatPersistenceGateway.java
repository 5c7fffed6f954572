package com.hello.chatrealtime.persistence;

import com.hello.chatrealtime.exception.PersistenceFailureException;
import com.hello.chatrealtime.model.MessageRef;
import com.hello.chatrealtime.model.MessageStatus;
import com.hello.chatrealtime.model.RoomKey;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Operations the real-time layer needs from the storage/identity service. Every
 * method may block and may throw {@link PersistenceFailureException}.
 */
public interface ChatPersistenceGateway {

    boolean userExists(String userId);

    /**
     * Persisted membership check. Governs who may join a room's live set.
     */
    boolean isMember(String userId, RoomKey room);

    /**
     * Messages in any room the user belongs to, sent by someone else, not deleted,
     * and still in {@link MessageStatus#SENT}.
     */
    List<MessageRef> findUndeliveredMessages(String userId);

    /**
     * Messages among {@code messageIds} that belong to {@code room}, were not sent
     * by {@code excludeSenderId}, are not deleted, and have not yet reached
     * {@code target}.
     */
    List<MessageRef> findMessagesBelowStatus(RoomKey room, Collection<String> messageIds, MessageStatus target,
            String excludeSenderId);

    /**
     * Moves messages forward to {@code target}. Rows already at or past the target
     * are left untouched; moving to READ also stamps a missing delivery time.
     *
     * @return ids of the messages whose status changed, in the order given
     */
    List<String> updateMessageStatus(Collection<String> messageIds, MessageStatus target, Instant at);

    /**
     * Moves one message from sent to delivered, but only if it belongs to
     * {@code room}, was sent by {@code senderId} and is not deleted.
     *
     * @return true if the message moved
     */
    boolean markDeliveredIfSentBy(RoomKey room, String senderId, String messageId, Instant at);

    void updateLastRead(String userId, RoomKey room, Instant at);

    void setUserOnline(String userId, boolean online, Instant at);
}
