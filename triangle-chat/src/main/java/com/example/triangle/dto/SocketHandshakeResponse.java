package com.example.triangle.dto;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SocketHandshakeResponse {
    String participant;
    List<String> channels;
}
