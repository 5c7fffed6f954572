package com.hello.chatrealtime.repository;

import com.hello.chatrealtime.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface UserRepository extends JpaRepository<User, String> {

    @Modifying
    @Query("UPDATE User u SET u.online = :online, u.lastActive = :at WHERE u.id = :id")
    int updateOnline(@Param("id") String id, @Param("online") boolean online, @Param("at") Instant at);
}
