package com.example.triangle.broadcast;

import com.example.triangle.event.ChatEventListener;
import com.example.triangle.event.ChatMessageEvent;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory registry scoped to this process. Other instances never see its subscribers.
 */
@Slf4j
public class LocalChannelBroadcaster implements ChannelBroadcaster {

    private final ConcurrentMap<String, List<ChannelSubscription>> topics = new ConcurrentHashMap<>();
    private final int mailboxCapacity;

    public LocalChannelBroadcaster(int mailboxCapacity) {
        this.mailboxCapacity = mailboxCapacity;
    }

    @Override
    public MailboxSubscription subscribe(String channelName) {
        return register(new MailboxSubscription(channelName, this, mailboxCapacity));
    }

    @Override
    public ChannelSubscription subscribe(String channelName, ChatEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("Listener is required");
        }
        return register(new CallbackSubscription(channelName, this, listener));
    }

    @Override
    public void unsubscribe(ChannelSubscription subscription) {
        if (subscription == null) {
            return;
        }
        topics.computeIfPresent(subscription.getChannelName(), (name, subscribers) -> {
            subscribers.remove(subscription);
            return subscribers.isEmpty() ? null : subscribers;
        });
        subscription.deactivate();
        log.debug("Released {}", subscription);
    }

    @Override
    public int publish(String channelName, ChatMessageEvent event) {
        List<ChannelSubscription> subscribers = topics.get(channelName);
        if (subscribers == null || subscribers.isEmpty()) {
            log.debug("No live subscribers for channel {}", channelName);
            return 0;
        }
        int delivered = 0;
        // Serialize publishers of one topic so every subscriber observes the same order.
        synchronized (subscribers) {
            for (ChannelSubscription subscription : subscribers) {
                if (subscription.isActive()) {
                    subscription.deliver(event);
                    delivered++;
                }
            }
        }
        log.debug("Delivered event {} on channel {} to {} subscribers", event.getEventId(), channelName, delivered);
        return delivered;
    }

    @Override
    public int subscriberCount(String channelName) {
        List<ChannelSubscription> subscribers = topics.get(channelName);
        return subscribers == null ? 0 : subscribers.size();
    }

    private <S extends ChannelSubscription> S register(S subscription) {
        topics.compute(subscription.getChannelName(), (name, subscribers) -> {
            List<ChannelSubscription> target = subscribers != null ? subscribers : new CopyOnWriteArrayList<>();
            target.add(subscription);
            return target;
        });
        log.debug("Registered {}", subscription);
        return subscription;
    }
}
