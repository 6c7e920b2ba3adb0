package com.example.triangle.broadcast;

import com.example.triangle.event.ChatMessageEvent;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

public abstract class ChannelSubscription implements AutoCloseable {

    private final String id = UUID.randomUUID().toString();
    private final String channelName;
    private final ChannelBroadcaster owner;
    private final AtomicBoolean active = new AtomicBoolean(true);

    protected ChannelSubscription(String channelName, ChannelBroadcaster owner) {
        this.channelName = channelName;
        this.owner = owner;
    }

    public String getId() {
        return id;
    }

    public String getChannelName() {
        return channelName;
    }

    public boolean isActive() {
        return active.get();
    }

    abstract void deliver(ChatMessageEvent event);

    void deactivate() {
        active.set(false);
    }

    @Override
    public void close() {
        if (isActive()) {
            owner.unsubscribe(this);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + " on " + channelName + "]";
    }
}
