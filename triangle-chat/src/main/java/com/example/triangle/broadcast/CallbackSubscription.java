package com.example.triangle.broadcast;

import com.example.triangle.event.ChatEventListener;
import com.example.triangle.event.ChatMessageEvent;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CallbackSubscription extends ChannelSubscription {

    private final ChatEventListener listener;

    CallbackSubscription(String channelName, ChannelBroadcaster owner, ChatEventListener listener) {
        super(channelName, owner);
        this.listener = listener;
    }

    @Override
    void deliver(ChatMessageEvent event) {
        try {
            listener.onMessageEvent(event);
        } catch (RuntimeException ex) {
            // A failing listener must not stop delivery to the rest of the topic.
            log.warn("Listener {} failed on event {}", this, event.getEventId(), ex);
        }
    }
}
