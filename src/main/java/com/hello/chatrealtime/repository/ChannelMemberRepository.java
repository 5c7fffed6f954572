package com.hello.chatrealtime.repository;

import com.hello.chatrealtime.entity.ChannelMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface ChannelMemberRepository extends JpaRepository<ChannelMember, Long> {

    boolean existsByChannelIdAndUserId(String channelId, String userId);

    Optional<ChannelMember> findByChannelIdAndUserId(String channelId, String userId);

    @Modifying
    @Query("UPDATE ChannelMember cm SET cm.lastReadAt = :at WHERE cm.channelId = :channelId AND cm.userId = :userId")
    int updateLastReadAt(@Param("channelId") String channelId, @Param("userId") String userId,
            @Param("at") Instant at);
}
