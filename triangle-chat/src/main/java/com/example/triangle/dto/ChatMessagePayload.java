package com.example.triangle.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChatMessagePayload {

    @NotBlank
    private String channel;

    private String content;

    private String type = "text";
}
