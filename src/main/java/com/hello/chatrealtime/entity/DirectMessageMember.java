package com.hello.chatrealtime.entity;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

@Entity
@Table(name = "direct_message_members", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"dm_id", "user_id"})
})
@Getter
@Setter
@NoArgsConstructor
public class DirectMessageMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dm_id", nullable = false, length = 36)
    private String dmId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(nullable = false)
    private Instant joinedAt;

    private Instant lastReadAt;

    @PrePersist
    protected void onCreate() {
        if (joinedAt == null) {
            joinedAt = Instant.now();
        }
    }

    public DirectMessageMember(String dmId, String userId) {
        this.dmId = dmId;
        this.userId = userId;
        this.joinedAt = Instant.now();
    }
}
