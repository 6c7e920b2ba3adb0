package com.example.triangle.service.exception;

import org.springframework.http.HttpStatus;

public enum ChatErrorCode {
    CHANNEL_NOT_FOUND(HttpStatus.NOT_FOUND),
    SENDER_NOT_IN_CHANNEL(HttpStatus.FORBIDDEN),
    VALIDATION_ERROR(HttpStatus.UNPROCESSABLE_ENTITY),
    MESSAGE_NOT_FOUND(HttpStatus.NOT_FOUND),
    MESSAGE_CHANNEL_MISMATCH(HttpStatus.CONFLICT),
    ALREADY_EXISTS(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ChatErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
