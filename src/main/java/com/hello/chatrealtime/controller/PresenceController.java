package com.hello.chatrealtime.controller;

import com.hello.chatrealtime.dto.OnlineMembersResponse;
import com.hello.chatrealtime.dto.UserPresenceResponse;
import com.hello.chatrealtime.model.RoomKey;
import com.hello.chatrealtime.service.ConnectionLifecycleService;
import com.hello.chatrealtime.service.RoomMembershipService;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only view of live state for the HTTP side: whether a user is connected and
 * who is currently subscribed to a room.
 */
@RestController
@RequestMapping("/api/presence")
public class PresenceController {

    private final ConnectionLifecycleService lifecycleService;
    private final RoomMembershipService roomMembershipService;

    public PresenceController(ConnectionLifecycleService lifecycleService,
            RoomMembershipService roomMembershipService) {
        this.lifecycleService = lifecycleService;
        this.roomMembershipService = roomMembershipService;
    }

    @GetMapping("/users/{userId}")
    public UserPresenceResponse getUserPresence(@PathVariable @NonNull String userId) {
        return UserPresenceResponse.builder()
                .userId(userId)
                .online(lifecycleService.isOnline(userId))
                .build();
    }

    @GetMapping("/channels/{channelId}")
    public OnlineMembersResponse getOnlineChannelMembers(@PathVariable @NonNull String channelId) {
        return onlineMembers(RoomKey.channel(channelId));
    }

    @GetMapping("/dms/{dmId}")
    public OnlineMembersResponse getOnlineDmMembers(@PathVariable @NonNull String dmId) {
        return onlineMembers(RoomKey.dm(dmId));
    }

    private OnlineMembersResponse onlineMembers(RoomKey room) {
        List<String> userIds = roomMembershipService.listOnlineMembers(room).stream()
                .sorted()
                .collect(Collectors.toList());
        return OnlineMembersResponse.builder()
                .roomId(room.id())
                .onlineUserIds(userIds)
                .build();
    }
}
