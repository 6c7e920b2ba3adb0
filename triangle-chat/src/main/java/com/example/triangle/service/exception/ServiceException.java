package com.example.triangle.service.exception;

import org.springframework.http.HttpStatus;

public class ServiceException extends RuntimeException {

    private final ChatErrorCode errorCode;

    public ServiceException(ChatErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public ServiceException(ChatErrorCode errorCode, String message, Throwable cause) {
        super(message, cause, false, errorCode.getStatus().is5xxServerError());
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return errorCode.getStatus();
    }

    public ChatErrorCode getErrorCode() {
        return errorCode;
    }
}
