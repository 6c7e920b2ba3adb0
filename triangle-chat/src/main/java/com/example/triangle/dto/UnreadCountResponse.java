package com.example.triangle.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UnreadCountResponse {
    String channel;
    String participant;
    long unread;
}
