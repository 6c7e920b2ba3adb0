package com.example.triangle.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@ConditionalOnProperty(prefix = "chat.broadcast", name = "relay", havingValue = "redis")
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(ChatProperties chatProperties) {
        ChatProperties.Redis redis = chatProperties.getRedis();
        Config config = new Config();
        config.useSingleServer()
                .setAddress(redis.getAddress())
                .setDatabase(redis.getDatabase())
                .setPassword(StringUtils.hasText(redis.getPassword()) ? redis.getPassword() : null);
        return Redisson.create(config);
    }
}
