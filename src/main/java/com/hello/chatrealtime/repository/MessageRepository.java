package com.hello.chatrealtime.repository;

import com.hello.chatrealtime.entity.Message;
import com.hello.chatrealtime.model.MessageStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface MessageRepository extends JpaRepository<Message, String> {

    @Query("SELECT m FROM Message m WHERE m.senderId <> :userId AND m.status = :status AND m.deleted = false "
            + "AND (m.channelId IN (SELECT cm.channelId FROM ChannelMember cm WHERE cm.userId = :userId) "
            + "OR m.dmId IN (SELECT dm.dmId FROM DirectMessageMember dm WHERE dm.userId = :userId)) "
            + "ORDER BY m.createdAt ASC")
    List<Message> findForRecipientWithStatus(@Param("userId") String userId, @Param("status") MessageStatus status);

    @Query("SELECT m FROM Message m WHERE m.id IN :ids AND m.channelId = :channelId AND m.senderId <> :excludeSenderId "
            + "AND m.deleted = false AND m.status IN :statuses")
    List<Message> findInChannel(@Param("channelId") String channelId, @Param("ids") Collection<String> ids,
            @Param("excludeSenderId") String excludeSenderId, @Param("statuses") Collection<MessageStatus> statuses);

    @Query("SELECT m FROM Message m WHERE m.id IN :ids AND m.dmId = :dmId AND m.senderId <> :excludeSenderId "
            + "AND m.deleted = false AND m.status IN :statuses")
    List<Message> findInDm(@Param("dmId") String dmId, @Param("ids") Collection<String> ids,
            @Param("excludeSenderId") String excludeSenderId, @Param("statuses") Collection<MessageStatus> statuses);

    @Modifying
    @Query("UPDATE Message m SET m.status = :target, m.deliveredAt = :at WHERE m.id = :id AND m.status IN :from")
    int advanceToDelivered(@Param("id") String id, @Param("target") MessageStatus target,
            @Param("from") Collection<MessageStatus> from, @Param("at") Instant at);

    @Modifying
    @Query("UPDATE Message m SET m.status = :target, m.deliveredAt = :at WHERE m.id = :id "
            + "AND m.channelId = :channelId AND m.senderId = :senderId AND m.deleted = false AND m.status IN :from")
    int advanceToDeliveredInChannel(@Param("channelId") String channelId, @Param("senderId") String senderId,
            @Param("id") String id, @Param("target") MessageStatus target,
            @Param("from") Collection<MessageStatus> from, @Param("at") Instant at);

    @Modifying
    @Query("UPDATE Message m SET m.status = :target, m.deliveredAt = :at WHERE m.id = :id "
            + "AND m.dmId = :dmId AND m.senderId = :senderId AND m.deleted = false AND m.status IN :from")
    int advanceToDeliveredInDm(@Param("dmId") String dmId, @Param("senderId") String senderId,
            @Param("id") String id, @Param("target") MessageStatus target,
            @Param("from") Collection<MessageStatus> from, @Param("at") Instant at);

    @Modifying
    @Query("UPDATE Message m SET m.status = :target, m.readAt = :at WHERE m.id = :id AND m.status IN :from")
    int advanceToRead(@Param("id") String id, @Param("target") MessageStatus target,
            @Param("from") Collection<MessageStatus> from, @Param("at") Instant at);

    @Modifying
    @Query("UPDATE Message m SET m.deliveredAt = :at WHERE m.id = :id AND m.deliveredAt IS NULL "
            + "AND m.status IN :from")
    int stampMissingDeliveredAt(@Param("id") String id, @Param("from") Collection<MessageStatus> from,
            @Param("at") Instant at);
}
