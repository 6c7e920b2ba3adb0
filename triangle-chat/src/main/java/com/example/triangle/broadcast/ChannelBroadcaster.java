package com.example.triangle.broadcast;

import com.example.triangle.event.ChatEventListener;
import com.example.triangle.event.ChatMessageEvent;

/**
 * Topic-based fan-out of message events, one topic per canonical channel name.
 *
 * <p>Delivery is best-effort: only subscriptions registered when an event is published receive it. Within one topic
 * events reach every subscriber in publish order. Subscriptions must be released with {@link #unsubscribe} or
 * {@link ChannelSubscription#close()}.
 */
public interface ChannelBroadcaster {

    /**
     * Registers a subscription whose events are buffered until the owner polls them.
     */
    MailboxSubscription subscribe(String channelName);

    /**
     * Registers a subscription that hands each event to {@code listener} on the publishing thread.
     */
    ChannelSubscription subscribe(String channelName, ChatEventListener listener);

    void unsubscribe(ChannelSubscription subscription);

    /**
     * @return the number of local subscriptions the event was delivered to
     */
    int publish(String channelName, ChatMessageEvent event);

    int subscriberCount(String channelName);
}
