package com.example.triangle.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage implements Serializable {

    private String id;
    private String channelId;
    private long sequence;
    private String sender;
    private MessageType type;
    private String content;
    private Map<String, Object> metadata;
    private boolean deleted;
    private Instant editedAt;
    private Instant createdAt;
}
