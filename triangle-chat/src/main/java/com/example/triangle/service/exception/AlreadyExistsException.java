package com.example.triangle.service.exception;

public class AlreadyExistsException extends ServiceException {

    public AlreadyExistsException(String message, Throwable cause) {
        super(ChatErrorCode.ALREADY_EXISTS, message, cause);
    }
}
