package com.example.triangle.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Channel implements Serializable {

    private String id;
    private String name;
    private ChannelType type;
    private List<String> participants;
    private String description;
    private Instant lastActivityAt;
    private Instant createdAt;

    public boolean hasParticipant(String participant) {
        return participants != null && participant != null && participants.contains(participant);
    }
}
