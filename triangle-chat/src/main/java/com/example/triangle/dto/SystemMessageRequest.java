package com.example.triangle.dto;

import lombok.Data;

@Data
public class SystemMessageRequest {

    private String content;
}
