package com.example.triangle.dto;

import lombok.Data;

@Data
public class EditMessageRequest {

    private String content;
}
