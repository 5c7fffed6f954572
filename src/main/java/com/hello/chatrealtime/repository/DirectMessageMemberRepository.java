package com.hello.chatrealtime.repository;

import com.hello.chatrealtime.entity.DirectMessageMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface DirectMessageMemberRepository extends JpaRepository<DirectMessageMember, Long> {

    boolean existsByDmIdAndUserId(String dmId, String userId);

    Optional<DirectMessageMember> findByDmIdAndUserId(String dmId, String userId);

    @Modifying
    @Query("UPDATE DirectMessageMember dm SET dm.lastReadAt = :at WHERE dm.dmId = :dmId AND dm.userId = :userId")
    int updateLastReadAt(@Param("dmId") String dmId, @Param("userId") String userId, @Param("at") Instant at);
}
