package com.example.triangle.event;

import com.example.triangle.domain.ChatMessage;
import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageEvent implements Serializable {

    private String eventId;
    private ChatEventType type;
    private String channelName;
    private ChatMessage message;
    private Instant occurredAt;
}
