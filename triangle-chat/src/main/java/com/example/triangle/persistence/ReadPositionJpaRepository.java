package com.example.triangle.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReadPositionJpaRepository extends JpaRepository<ReadPositionEntity, String> {

    Optional<ReadPositionEntity> findByChannel_IdAndParticipant(String channelId, String participant);

    @Query("select r from ReadPositionEntity r join fetch r.channel where r.participant = :participant")
    List<ReadPositionEntity> findAllForParticipant(@Param("participant") String participant);

    /**
     * Forward-only cursor move; a no-op when the stored cursor is already at or past {@code readAt}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ReadPositionEntity r set r.lastReadAt = :readAt, r.lastReadMessageId = :messageId, "
            + "r.updatedAt = :updatedAt "
            + "where r.channel.id = :channelId and r.participant = :participant "
            + "and (r.lastReadAt is null or r.lastReadAt < :readAt)")
    int advance(
            @Param("channelId") String channelId,
            @Param("participant") String participant,
            @Param("readAt") Instant readAt,
            @Param("messageId") String messageId,
            @Param("updatedAt") Instant updatedAt);
}
