package com.example.triangle.persistence;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChannelJpaRepository extends JpaRepository<ChannelEntity, String> {

    Optional<ChannelEntity> findByName(String name);

    List<ChannelEntity> findAllByOrderByNameAsc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from ChannelEntity c where c.id = :id")
    Optional<ChannelEntity> lockById(@Param("id") String id);

    @Modifying
    @Query("update ChannelEntity c set c.lastActivityAt = :activityAt, c.updatedAt = :activityAt where c.id = :id")
    int updateLastActivity(@Param("id") String id, @Param("activityAt") Instant activityAt);
}
