package com.example.triangle.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Window over a channel's history. {@code since} and {@code before} are exclusive bounds; {@code limit} keeps the
 * newest matching messages, which are still returned oldest first.
 */
@Value
@Builder(toBuilder = true)
public class MessageQuery {

    Instant since;
    Instant before;
    Integer limit;
    boolean includeDeleted;

    public static MessageQuery defaults() {
        return MessageQuery.builder().build();
    }
}
