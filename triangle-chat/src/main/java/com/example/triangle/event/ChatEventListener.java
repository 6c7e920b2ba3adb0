package com.example.triangle.event;

@FunctionalInterface
public interface ChatEventListener {

    void onMessageEvent(ChatMessageEvent event);
}
