package com.example.triangle.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Omitting {@code messageId} marks everything up to now as read.
 */
@Data
public class MarkReadRequest {

    @NotBlank
    private String participant;

    private String messageId;
}
