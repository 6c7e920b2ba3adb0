package com.example.triangle.persistence;

import com.example.triangle.domain.MessageType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

@Getter
@Setter
@Entity
@Table(
        name = "chat_messages",
        uniqueConstraints = @UniqueConstraint(
                name = "chat_messages_channel_sequence_unique", columnNames = {"channel_id", "sequence_number"}),
        indexes = {
            @Index(name = "chat_messages_channel_timestamp_idx", columnList = "channel_id, created_at"),
            @Index(name = "chat_messages_sender_idx", columnList = "sender, created_at")
        })
public class MessageEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "channel_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private ChannelEntity channel;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequence;

    @Column(name = "sender", nullable = false, updatable = false, length = 64)
    private String sender;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, length = 16)
    private MessageType messageType;

    @Column(name = "metadata", columnDefinition = "text")
    private String metadata;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "edited_at")
    private Instant editedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
