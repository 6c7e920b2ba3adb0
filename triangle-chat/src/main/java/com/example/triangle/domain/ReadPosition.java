package com.example.triangle.domain;

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
public class ReadPosition implements Serializable {

    private String id;
    private String channelId;
    private String participant;

    /**
     * Creation time of the newest message the participant has consumed; {@code null} means nothing has been read.
     */
    private Instant lastReadAt;

    private String lastReadMessageId;
}
