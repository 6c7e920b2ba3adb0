package com.example.triangle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TriangleChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriangleChatApplication.class, args);
    }
}
