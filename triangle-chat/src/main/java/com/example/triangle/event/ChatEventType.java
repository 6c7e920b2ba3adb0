package com.example.triangle.event;

public enum ChatEventType {
    MESSAGE_CREATED,
    MESSAGE_EDITED,
    MESSAGE_DELETED
}
