package com.example.triangle.persistence;

import com.example.triangle.domain.ChannelType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "chat_channels",
        uniqueConstraints = @UniqueConstraint(name = "chat_channels_unique_name", columnNames = "name"),
        indexes = {
            @Index(name = "chat_channels_type_idx", columnList = "channel_type"),
            @Index(name = "chat_channels_activity_idx", columnList = "last_activity_at")
        })
public class ChannelEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, updatable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel_type", nullable = false, length = 16)
    private ChannelType channelType;

    @Column(name = "participants", nullable = false, columnDefinition = "text")
    private String participants;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    // Highest sequence number handed out to a message of this channel.
    @Column(name = "last_sequence", nullable = false)
    private long lastSequence;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
