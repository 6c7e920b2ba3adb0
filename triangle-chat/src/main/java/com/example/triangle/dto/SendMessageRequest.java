package com.example.triangle.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;

@Data
public class SendMessageRequest {

    @NotBlank
    private String sender;

    private String content;

    private String type = "text";

    private final Map<String, Object> metadata = new HashMap<>();
}
