package com.hello.chatrealtime.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.hello.chatrealtime.dto.CallInitiateRequest;
import com.hello.chatrealtime.dto.CallRequest;
import com.hello.chatrealtime.dto.ErrorEvent;
import com.hello.chatrealtime.dto.MessageChangeRequest;
import com.hello.chatrealtime.dto.MessageStatusRequest;
import com.hello.chatrealtime.dto.NewMessageRequest;
import com.hello.chatrealtime.dto.ReactionRequest;
import com.hello.chatrealtime.dto.RoomScopedRequest;
import com.hello.chatrealtime.dto.TypingRequest;
import com.hello.chatrealtime.exception.ClientEventException;
import com.hello.chatrealtime.exception.InvalidEventException;
import com.hello.chatrealtime.model.MessageStatus;
import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.model.RoomType;
import com.hello.chatrealtime.registry.Connection;
import com.hello.chatrealtime.service.CallSessionManager;
import com.hello.chatrealtime.service.MessageRelay;
import com.hello.chatrealtime.service.MessageStatusService;
import com.hello.chatrealtime.service.RoomMembershipService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Routes inbound events by name and is the error boundary for every handler:
 * user-actionable failures go back to the sender as an {@code error} event,
 * anything else is logged and the event dropped. Nothing thrown here reaches the
 * transport, so one bad event never closes the connection.
 */
@Component
public class ChatEventDispatcher {

    public static final String ERROR = "error";

    private static final Logger logger = LoggerFactory.getLogger(ChatEventDispatcher.class);

    private final EventPayloadReader payloadReader;
    private final RoomMembershipService roomMembershipService;
    private final MessageRelay messageRelay;
    private final MessageStatusService messageStatusService;
    private final CallSessionManager callSessionManager;

    public ChatEventDispatcher(EventPayloadReader payloadReader,
            RoomMembershipService roomMembershipService,
            MessageRelay messageRelay,
            MessageStatusService messageStatusService,
            CallSessionManager callSessionManager) {
        this.payloadReader = payloadReader;
        this.roomMembershipService = roomMembershipService;
        this.messageRelay = messageRelay;
        this.messageStatusService = messageStatusService;
        this.callSessionManager = callSessionManager;
    }

    public void dispatch(Connection connection, String eventName, JsonNode data) {
        Optional<InboundEvent> event = InboundEvent.fromWireName(eventName);
        if (event.isEmpty()) {
            connection.send(ERROR, new ErrorEvent("Unsupported event: " + eventName));
            return;
        }

        String userId = connection.getUserId();
        logger.debug("Dispatching {} from user {}", eventName, userId);
        try {
            route(event.get(), userId, data);
        } catch (ClientEventException e) {
            connection.send(ERROR, new ErrorEvent(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Failed to handle {} from user {}", eventName, userId, e);
            event.get().getFailureMessage()
                    .ifPresent(message -> connection.send(ERROR, new ErrorEvent(message)));
        }
    }

    private void route(InboundEvent event, String userId, JsonNode data) {
        switch (event) {
            case JOIN_CHANNEL -> roomMembershipService.join(userId, room(data, RoomType.CHANNEL));
            case JOIN_DM -> roomMembershipService.join(userId, room(data, RoomType.DM));
            case LEAVE_CHANNEL -> roomMembershipService.leave(userId, room(data, RoomType.CHANNEL));
            case LEAVE_DM -> roomMembershipService.leave(userId, room(data, RoomType.DM));
            case TYPING -> typing(userId, data, RoomType.CHANNEL);
            case DM_TYPING -> typing(userId, data, RoomType.DM);
            case NEW_MESSAGE -> newMessage(userId, data, RoomType.CHANNEL);
            case NEW_DM_MESSAGE -> newMessage(userId, data, RoomType.DM);
            case MESSAGE_EDITED -> messageEdited(userId, data, RoomType.CHANNEL);
            case DM_MESSAGE_EDITED -> messageEdited(userId, data, RoomType.DM);
            case MESSAGE_DELETED -> messageDeleted(userId, data, RoomType.CHANNEL);
            case DM_MESSAGE_DELETED -> messageDeleted(userId, data, RoomType.DM);
            case REACTION_UPDATE -> reaction(userId, data, RoomType.CHANNEL);
            case DM_REACTION_UPDATE -> reaction(userId, data, RoomType.DM);
            case MESSAGES_DELIVERED -> statusUpdate(userId, data, RoomType.CHANNEL, MessageStatus.DELIVERED);
            case MESSAGES_READ -> statusUpdate(userId, data, RoomType.CHANNEL, MessageStatus.READ);
            case DM_MESSAGES_DELIVERED -> statusUpdate(userId, data, RoomType.DM, MessageStatus.DELIVERED);
            case DM_MESSAGES_READ -> statusUpdate(userId, data, RoomType.DM, MessageStatus.READ);
            case CALL_INITIATE -> {
                CallInitiateRequest request = payloadReader.read(data, CallInitiateRequest.class);
                callSessionManager.initiate(userId, request.getReceiverId(), request.getType(),
                        request.getChannelId());
            }
            case CALL_ACCEPT -> callSessionManager.accept(userId, call(data).getCallId());
            case CALL_REJECT -> {
                CallRequest request = call(data);
                callSessionManager.reject(userId, request.getCallId(), request.getReason());
            }
            case CALL_END -> callSessionManager.end(userId, call(data).getCallId());
            case CALL_OFFER -> {
                CallRequest request = call(data);
                callSessionManager.offer(userId, request.getCallId(), request.getOffer());
            }
            case CALL_ANSWER -> {
                CallRequest request = call(data);
                callSessionManager.answer(userId, request.getCallId(), request.getAnswer());
            }
            case ICE_CANDIDATE -> {
                CallRequest request = call(data);
                callSessionManager.iceCandidate(userId, request.getCallId(), request.getCandidate());
            }
            case CALL_TOGGLE_MEDIA -> {
                CallRequest request = call(data);
                callSessionManager.toggleMedia(userId, request.getCallId(), request.getMediaType(),
                        request.getEnabled());
            }
            default -> throw new InvalidEventException("Unsupported event: " + event.getWireName());
        }
    }

    private RoomKey room(JsonNode data, RoomType type) {
        return payloadReader.read(data, RoomScopedRequest.class).requireRoom(type);
    }

    private CallRequest call(JsonNode data) {
        return payloadReader.read(data, CallRequest.class);
    }

    private void typing(String userId, JsonNode data, RoomType type) {
        TypingRequest request = payloadReader.read(data, TypingRequest.class);
        messageRelay.typing(userId, request.requireRoom(type), Boolean.TRUE.equals(request.getIsTyping()));
    }

    private void newMessage(String userId, JsonNode data, RoomType type) {
        NewMessageRequest request = payloadReader.read(data, NewMessageRequest.class);
        messageRelay.newMessage(userId, request.requireRoom(type), request.getMessage());
    }

    private void messageEdited(String userId, JsonNode data, RoomType type) {
        MessageChangeRequest request = payloadReader.read(data, MessageChangeRequest.class);
        messageRelay.messageEdited(userId, request.requireRoom(type), request.getMessageId(), request.getText());
    }

    private void messageDeleted(String userId, JsonNode data, RoomType type) {
        MessageChangeRequest request = payloadReader.read(data, MessageChangeRequest.class);
        messageRelay.messageDeleted(userId, request.requireRoom(type), request.getMessageId());
    }

    private void reaction(String userId, JsonNode data, RoomType type) {
        ReactionRequest request = payloadReader.read(data, ReactionRequest.class);
        messageRelay.reaction(userId, request.requireRoom(type), request.getMessageId(), request.getEmoji(),
                request.getAction());
    }

    private void statusUpdate(String userId, JsonNode data, RoomType type, MessageStatus kind) {
        MessageStatusRequest request = payloadReader.read(data, MessageStatusRequest.class);
        messageStatusService.onBulkStatusUpdate(kind, request.requireRoom(type), request.getMessageIds(), userId);
    }
}
