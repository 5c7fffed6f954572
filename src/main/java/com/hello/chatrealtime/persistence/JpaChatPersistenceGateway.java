package com.hello.chatrealtime.persistence;

import com.hello.chatrealtime.entity.Message;
import com.hello.chatrealtime.exception.PersistenceFailureException;
import com.hello.chatrealtime.model.MessageRef;
import com.hello.chatrealtime.model.MessageStatus;
import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.repository.ChannelMemberRepository;
import com.hello.chatrealtime.repository.DirectMessageMemberRepository;
import com.hello.chatrealtime.repository.MessageRepository;
import com.hello.chatrealtime.repository.UserRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link ChatPersistenceGateway} backed by the Spring Data repositories.
 */
@Service
public class JpaChatPersistenceGateway implements ChatPersistenceGateway {

    private final UserRepository userRepository;
    private final ChannelMemberRepository channelMemberRepository;
    private final DirectMessageMemberRepository directMessageMemberRepository;
    private final MessageRepository messageRepository;

    public JpaChatPersistenceGateway(UserRepository userRepository,
            ChannelMemberRepository channelMemberRepository,
            DirectMessageMemberRepository directMessageMemberRepository,
            MessageRepository messageRepository) {
        this.userRepository = userRepository;
        this.channelMemberRepository = channelMemberRepository;
        this.directMessageMemberRepository = directMessageMemberRepository;
        this.messageRepository = messageRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean userExists(String userId) {
        return call("userExists", () -> userRepository.existsById(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isMember(String userId, RoomKey room) {
        return call("isMember", () -> room.isChannel()
                ? channelMemberRepository.existsByChannelIdAndUserId(room.id(), userId)
                : directMessageMemberRepository.existsByDmIdAndUserId(room.id(), userId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<MessageRef> findUndeliveredMessages(String userId) {
        return call("findUndeliveredMessages", () ->
                toRefs(messageRepository.findForRecipientWithStatus(userId, MessageStatus.SENT)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<MessageRef> findMessagesBelowStatus(RoomKey room, Collection<String> messageIds,
            MessageStatus target, String excludeSenderId) {
        if (messageIds.isEmpty()) {
            return List.of();
        }
        List<MessageStatus> earlier = statusesBefore(target);
        if (earlier.isEmpty()) {
            return List.of();
        }
        return call("findMessagesBelowStatus", () -> toRefs(room.isChannel()
                ? messageRepository.findInChannel(room.id(), messageIds, excludeSenderId, earlier)
                : messageRepository.findInDm(room.id(), messageIds, excludeSenderId, earlier)));
    }

    @Override
    @Transactional
    public List<String> updateMessageStatus(Collection<String> messageIds, MessageStatus target, Instant at) {
        List<MessageStatus> earlier = statusesBefore(target);
        if (messageIds.isEmpty() || earlier.isEmpty()) {
            return List.of();
        }
        return call("updateMessageStatus", () -> {
            // one guarded update per row: only rows this call moved are reported
            List<String> moved = new ArrayList<>();
            for (String id : messageIds) {
                if (advance(id, target, earlier, at) == 1) {
                    moved.add(id);
                }
            }
            return moved;
        });
    }

    @Override
    @Transactional
    public boolean markDeliveredIfSentBy(RoomKey room, String senderId, String messageId, Instant at) {
        List<MessageStatus> earlier = statusesBefore(MessageStatus.DELIVERED);
        return call("markDeliveredIfSentBy", () -> (room.isChannel()
                ? messageRepository.advanceToDeliveredInChannel(room.id(), senderId, messageId,
                        MessageStatus.DELIVERED, earlier, at)
                : messageRepository.advanceToDeliveredInDm(room.id(), senderId, messageId,
                        MessageStatus.DELIVERED, earlier, at)) == 1);
    }

    @Override
    @Transactional
    public void updateLastRead(String userId, RoomKey room, Instant at) {
        call("updateLastRead", () -> room.isChannel()
                ? channelMemberRepository.updateLastReadAt(room.id(), userId, at)
                : directMessageMemberRepository.updateLastReadAt(room.id(), userId, at));
    }

    @Override
    @Transactional
    public void setUserOnline(String userId, boolean online, Instant at) {
        call("setUserOnline", () -> userRepository.updateOnline(userId, online, at));
    }

    private int advance(String id, MessageStatus target, List<MessageStatus> earlier, Instant at) {
        if (target == MessageStatus.DELIVERED) {
            return messageRepository.advanceToDelivered(id, target, earlier, at);
        }
        // read implies delivered
        messageRepository.stampMissingDeliveredAt(id, earlier, at);
        return messageRepository.advanceToRead(id, target, earlier, at);
    }

    private static List<MessageStatus> statusesBefore(MessageStatus target) {
        return Arrays.stream(MessageStatus.values())
                .filter(status -> status.isBefore(target))
                .collect(Collectors.toList());
    }

    private static List<MessageRef> toRefs(List<Message> messages) {
        return messages.stream()
                .map(m -> new MessageRef(m.getId(), m.getSenderId(), m.getRoom()))
                .collect(Collectors.toList());
    }

    private static <T> T call(String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException(operation + " failed", e);
        }
    }
}
