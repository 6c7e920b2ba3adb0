package com.example.triangle.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ReadPayload {

    @NotBlank
    private String channel;

    private String messageId;
}
