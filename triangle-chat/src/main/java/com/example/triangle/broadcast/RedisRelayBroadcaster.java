package com.example.triangle.broadcast;

import com.example.triangle.event.ChatEventListener;
import com.example.triangle.event.ChatMessageEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;

/**
 * Local fan-out plus a Redis topic that mirrors every publish to the other instances. Each instance delivers its own
 * publishes directly and ignores their echo from Redis.
 */
@Slf4j
public class RedisRelayBroadcaster implements ChannelBroadcaster {

    private final LocalChannelBroadcaster local;
    private final RTopic topic;
    private final String instanceId = UUID.randomUUID().toString();

    private int listenerId = -1;

    public RedisRelayBroadcaster(
            LocalChannelBroadcaster local, RedissonClient redissonClient, ObjectMapper objectMapper, String topicName) {
        this.local = local;
        this.topic = redissonClient.getTopic(topicName, new TypedJsonJacksonCodec(RelayEnvelope.class, objectMapper));
    }

    @PostConstruct
    public void start() {
        listenerId = topic.addListener(RelayEnvelope.class, (channel, envelope) -> onRelayed(envelope));
        log.info("Relaying channel broadcasts through Redis as instance {}", instanceId);
    }

    @PreDestroy
    public void stop() {
        if (listenerId >= 0) {
            topic.removeListener(listenerId);
            listenerId = -1;
        }
    }

    @Override
    public MailboxSubscription subscribe(String channelName) {
        return local.subscribe(channelName);
    }

    @Override
    public ChannelSubscription subscribe(String channelName, ChatEventListener listener) {
        return local.subscribe(channelName, listener);
    }

    @Override
    public void unsubscribe(ChannelSubscription subscription) {
        local.unsubscribe(subscription);
    }

    @Override
    public int publish(String channelName, ChatMessageEvent event) {
        int delivered = local.publish(channelName, event);
        try {
            topic.publish(RelayEnvelope.builder()
                    .originId(instanceId)
                    .channelName(channelName)
                    .event(event)
                    .build());
        } catch (RuntimeException ex) {
            log.warn("Failed to relay event {} for channel {}", event.getEventId(), channelName, ex);
        }
        return delivered;
    }

    @Override
    public int subscriberCount(String channelName) {
        return local.subscriberCount(channelName);
    }

    String getInstanceId() {
        return instanceId;
    }

    void onRelayed(RelayEnvelope envelope) {
        if (envelope == null || instanceId.equals(envelope.getOriginId())) {
            return;
        }
        local.publish(envelope.getChannelName(), envelope.getEvent());
    }
}
