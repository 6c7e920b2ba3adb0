package com.example.triangle.config;

import com.example.triangle.broadcast.LocalChannelBroadcaster;
import com.example.triangle.broadcast.RedisRelayBroadcaster;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class BroadcastConfig {

    @Bean
    public LocalChannelBroadcaster localChannelBroadcaster(ChatProperties chatProperties) {
        return new LocalChannelBroadcaster(chatProperties.getBroadcast().getBufferSize());
    }

    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "chat.broadcast", name = "relay", havingValue = "redis")
    public RedisRelayBroadcaster redisRelayBroadcaster(
            LocalChannelBroadcaster localChannelBroadcaster,
            RedissonClient redissonClient,
            ObjectMapper objectMapper,
            ChatProperties chatProperties) {
        return new RedisRelayBroadcaster(
                localChannelBroadcaster,
                redissonClient,
                objectMapper,
                chatProperties.getBroadcast().getRelayTopic());
    }
}
