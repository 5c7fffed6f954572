package com.hello.chatrealtime.entity;

import com.hello.chatrealtime.model.MessageStatus;
import com.hello.chatrealtime.model.RoomKey;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A chat message as far as delivery tracking is concerned. Exactly one of
 * {@code channelId} and {@code dmId} is set.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(columnList = "channel_id"),
    @Index(columnList = "dm_id"),
    @Index(columnList = "sender_id")
})
@Getter
@Setter
@NoArgsConstructor
public class Message {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "channel_id", length = 36)
    private String channelId;

    @Column(name = "dm_id", length = 36)
    private String dmId;

    @Column(name = "sender_id", nullable = false, length = 36)
    private String senderId;

    @Column(length = 4000)
    private String text;

    @Column(nullable = false)
    private boolean deleted;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MessageStatus status = MessageStatus.SENT;

    private Instant deliveredAt;

    private Instant readAt;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public Message(RoomKey room, String senderId, String text) {
        this.id = UUID.randomUUID().toString();
        if (room.isChannel()) {
            this.channelId = room.id();
        } else {
            this.dmId = room.id();
        }
        this.senderId = senderId;
        this.text = text;
        this.createdAt = Instant.now();
    }

    public RoomKey getRoom() {
        return channelId != null ? RoomKey.channel(channelId) : RoomKey.dm(dmId);
    }
}
